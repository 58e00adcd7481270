package com.switchboard.streaming;

import com.switchboard.model.ToolCall;
import com.switchboard.model.Usage;

import java.util.List;

/**
 * Provider-neutral event decoded from one upstream stream frame.
 * Adapters map their wire events onto these; {@link StreamingNormalizer} turns them into chunks.
 */
public sealed interface UpstreamEvent {

    static UpstreamEvent content(String text) {
        return new ContentDelta(text);
    }

    static UpstreamEvent toolCalls(List<ToolCall> toolCalls) {
        return new ToolCallDelta(List.copyOf(toolCalls));
    }

    static UpstreamEvent finish(String reason) {
        return new Finish(reason);
    }

    static UpstreamEvent usage(Usage usage) {
        return new UsageReport(usage);
    }

    static UpstreamEvent ignored(String type) {
        return new Ignored(type);
    }

    record ContentDelta(String text) implements UpstreamEvent {
    }

    record ToolCallDelta(List<ToolCall> toolCalls) implements UpstreamEvent {
    }

    /**
     * Upstream completion reason, already mapped to the unified vocabulary (stop, length, tool_calls, ...).
     */
    record Finish(String reason) implements UpstreamEvent {
    }

    /**
     * Token counts; partial reports are merged, later non-null fields win.
     */
    record UsageReport(Usage usage) implements UpstreamEvent {
    }

    /**
     * Keep-alives, bookkeeping events and the {@code [DONE]} sentinel.
     */
    record Ignored(String type) implements UpstreamEvent {
    }
}
