package io.intellixity.pagekit.cursor;

/** Outcome of {@link CursorCodec#decode(String)}; decoding never throws. */
public interface CursorDecoding {

  record Decoded(CursorKey key) implements CursorDecoding {}

  record Malformed(String reason) implements CursorDecoding {}

  static CursorDecoding decoded(CursorKey key) { return new Decoded(key); }

  static CursorDecoding malformed(String reason) { return new Malformed(reason); }
}
