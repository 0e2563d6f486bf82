package io.intellixity.pagekit.cursor;

/**
 * Opaque token codec for {@link CursorKey}s. Tokens carry key values only, never positions, so a
 * token stays meaningful while the underlying collection changes.
 */
public interface CursorCodec {
  String encode(CursorKey key);

  CursorDecoding decode(String token);
}
