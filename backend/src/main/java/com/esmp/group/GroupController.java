package com.esmp.group;

import com.esmp.thread.ThreadEntry;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/groups")
public class GroupController {

    private final GroupService groupService;

    public GroupController(GroupService groupService) {
        this.groupService = groupService;
    }

    @GetMapping("/{groupId}")
    public Mono<ResponseEntity<GroupView>> getGroup(@PathVariable String groupId) {
        return groupService.find(groupId)
                .map(group -> ResponseEntity.ok(GroupView.of(group)))
                .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    /**
     * The group thread in log order. Unknown groups answer 404 through the error handler.
     */
    @GetMapping("/{groupId}/messages")
    public Flux<ThreadEntry> getMessages(
            @PathVariable String groupId,
            @RequestParam(name = "from", defaultValue = "1") long fromSeq,
            @RequestParam(name = "to", defaultValue = "9223372036854775807") long toSeq) {
        return groupService.messages(groupId, fromSeq, toSeq);
    }
}
