package com.switchboard.streaming;

import com.switchboard.exception.GatewayErrors;
import com.switchboard.exception.GatewayException;
import com.switchboard.model.ChatCompletionChunk;
import com.switchboard.model.Usage;
import com.switchboard.resilience.CancellationToken;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Turns a provider's decoded stream into canonical chunks.
 *
 * <ul>
 *     <li>every chunk carries the same id; the first one carries role {@code assistant}, no other does</li>
 *     <li>deltas are emitted in arrival order</li>
 *     <li>the finish reason is held back and emitted once, in the last chunk, with an empty delta;
 *     {@code stop} is used when the upstream never reported one</li>
 *     <li>an upstream failure ends the sequence with the classified error; nothing already emitted is retracted</li>
 * </ul>
 *
 * State is created per subscription, so the returned publisher can be subscribed more than once.
 */
@Slf4j
public final class StreamingNormalizer {

    private StreamingNormalizer() {
    }

    public static Flux<ChatCompletionChunk> normalize(Flux<UpstreamEvent> upstream, String id, String model,
                                                      CancellationToken cancellation) {
        return Flux.defer(() -> {
            State state = new State(ChunkFactory.create(id, model));
            Flux<ChatCompletionChunk> body = upstream
                    .onErrorMap(error -> !(error instanceof GatewayException), GatewayErrors::classify)
                    .concatMapIterable(state::accept);
            return cancellation.guard(body, "chat stream")
                    .concatWith(Flux.defer(() -> Flux.fromIterable(state.finish())));
        });
    }

    private static final class State {

        private final ChunkFactory chunks;
        private boolean roleSent;
        private String finishReason;
        private Usage usage;

        State(ChunkFactory chunks) {
            this.chunks = chunks;
        }

        List<ChatCompletionChunk> accept(UpstreamEvent event) {
            if (event instanceof UpstreamEvent.ContentDelta delta) {
                if (delta.text() == null || delta.text().isEmpty()) {
                    return roleChunkIfFirst();
                }
                return List.of(chunks.content(delta.text(), markRole()));
            }
            if (event instanceof UpstreamEvent.ToolCallDelta delta) {
                return List.of(chunks.toolCalls(delta.toolCalls(), markRole()));
            }
            if (event instanceof UpstreamEvent.Finish finish) {
                if (finishReason != null) {
                    log.debug("Ignoring repeated finish reason {} for {}", finish.reason(), chunks.getId());
                } else {
                    finishReason = finish.reason();
                }
                return List.of();
            }
            if (event instanceof UpstreamEvent.UsageReport report) {
                usage = merge(usage, report.usage());
                return List.of();
            }
            return List.of();
        }

        List<ChatCompletionChunk> finish() {
            ChatCompletionChunk terminal = chunks.terminal(finishReason, usage != null ? usage.withTotal() : null);
            if (roleSent) {
                return List.of(terminal);
            }
            roleSent = true;
            return List.of(chunks.role(), terminal);
        }

        private List<ChatCompletionChunk> roleChunkIfFirst() {
            if (roleSent) {
                return List.of();
            }
            roleSent = true;
            return List.of(chunks.role());
        }

        private boolean markRole() {
            if (roleSent) {
                return false;
            }
            roleSent = true;
            return true;
        }
    }

    static Usage merge(Usage current, Usage update) {
        if (update == null) {
            return current;
        }
        if (current == null) {
            return Usage.builder()
                    .promptTokens(update.getPromptTokens())
                    .completionTokens(update.getCompletionTokens())
                    .totalTokens(update.getTotalTokens())
                    .build();
        }
        return Usage.builder()
                .promptTokens(update.getPromptTokens() != null ? update.getPromptTokens() : current.getPromptTokens())
                .completionTokens(update.getCompletionTokens() != null
                        ? update.getCompletionTokens() : current.getCompletionTokens())
                // a stale total is dropped so the terminal chunk recomputes it from the merged parts
                .totalTokens(update.getTotalTokens())
                .build();
    }
}
