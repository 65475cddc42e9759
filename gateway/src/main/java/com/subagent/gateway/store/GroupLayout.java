package com.subagent.gateway.store;

/** On-disk shape of persisted groups. */
public enum GroupLayout {
    /** One JSON file: {@code {"instructions": ..., "groups": [...]}}. */
    JSON_FILE,
    /** One directory per group holding {@code group.json} and optional markdown overrides. */
    DIRECTORY
}
