package com.github.automata;

import java.util.List;
import java.util.Optional;

/**
 * Produces an externally visible value when a State is entered or a Transition is exercised. The
 * history handed in is a snapshot of the records since the last reset, taken before the step is
 * committed. An empty result means the step produced nothing.
 */
@FunctionalInterface
public interface Acceptor {

  Optional<Object> accept(final Object input, final List<HistoryRecord> history);

}
