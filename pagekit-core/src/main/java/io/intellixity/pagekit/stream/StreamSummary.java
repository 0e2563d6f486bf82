package io.intellixity.pagekit.stream;

/**
 * @param emitted   rows handed to the consumer
 * @param cancelled true when the signal stopped the stream before the sequence or limit was exhausted
 */
public record StreamSummary(long emitted, boolean cancelled) {}
