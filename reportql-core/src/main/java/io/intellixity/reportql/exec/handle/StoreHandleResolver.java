package io.intellixity.reportql.exec.handle;

/**
 * Maps a source's store id to its handle. Resolution is a static lookup and never looks at query text.
 * <p>
 * Implementations throw {@link IllegalArgumentException} for an unknown store id.
 */
@FunctionalInterface
public interface StoreHandleResolver<H extends StoreHandle<?>> {
  H resolve(String storeId);
}
