package com.esmp.profile;

import com.esmp.envelope.WireFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/users/{pubkey}/profile")
public class ProfileController {

    private final ProfileService profileService;
    private final WireFormat wireFormat;

    public ProfileController(ProfileService profileService, WireFormat wireFormat) {
        this.profileService = profileService;
        this.wireFormat = wireFormat;
    }

    /**
     * Public view by default. With {@code as} equal to the profile key and a valid signed
     * timestamp in the headers, the owner gets every field including the decrypted address.
     */
    @GetMapping
    public Mono<ResponseEntity<ProfileView>> getProfile(
            @PathVariable String pubkey,
            @RequestParam(name = "as", required = false) String as,
            @RequestHeader(name = OwnerProof.TIMESTAMP_HEADER, required = false) String timestamp,
            @RequestHeader(name = OwnerProof.SIGNATURE_HEADER, required = false) String signature) {
        return profileService.getProfile(pubkey, as, new OwnerProof(timestamp, signature))
                .map(ResponseEntity::ok)
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    // Raw bytes: the body is signed, so it goes through the strict reader.
    @PutMapping
    public Mono<ProfileView> updateProfile(@PathVariable String pubkey, @RequestBody byte[] body) {
        return Mono.fromCallable(() -> wireFormat.readObject(body))
                .flatMap(object -> profileService.applySignedUpdate(pubkey, object));
    }
}
