package org.stianloader.picopip.marker;

import org.jetbrains.annotations.Nullable;

/**
 * The result of {@link MarkerAlgebra#strip(Marker, MarkerVariable)}.
 *
 * @param remainder The marker without the stripped comparisons, or null if nothing remains
 * @param modified Whether any comparison was removed
 */
public record StrippedMarker(@Nullable Marker remainder, boolean modified) {
}
