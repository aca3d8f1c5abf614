package com.esmp.group;

import com.esmp.thread.ThreadKey;

/**
 * Result of an envelope accepted into a group thread: the group state after it was applied
 * and where it was logged.
 */
public record GroupAppend(GroupMetadata group, ThreadKey threadKey, long seq) {}
