package com.esmp.message;

import com.esmp.thread.ThreadKey;

/** Where an accepted envelope was appended. */
public record LogPosition(ThreadKey threadKey, long seq) {}
