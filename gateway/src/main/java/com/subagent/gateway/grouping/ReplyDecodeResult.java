package com.subagent.gateway.grouping;

import com.subagent.gateway.model.ToolGroup;

import java.util.List;

/**
 * Tagged outcome of decoding a final-assignment reply: either a complete,
 * checked list of groups or the reason the reply was rejected. Never both.
 */
public record ReplyDecodeResult(List<ToolGroup> groups, String error) {

    public static ReplyDecodeResult ok(List<ToolGroup> groups) {
        return new ReplyDecodeResult(List.copyOf(groups), null);
    }

    public static ReplyDecodeResult failure(String error) {
        return new ReplyDecodeResult(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
