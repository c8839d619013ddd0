package org.Aayush.ontology.constraint;

import lombok.experimental.UtilityClass;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * Pull-based lazy sequence helpers backing constraint walkers.
 *
 * <p>Every helper computes at most one element ahead of the consumer, so the cost of
 * a walker is proportional to the number of candidates actually pulled.</p>
 */
@UtilityClass
final class Candidates {

    static <T> Iterator<T> empty() {
        return Collections.emptyIterator();
    }

    /**
     * Returns a sequence holding the supplier's value, computed on first pull; {@code null} means empty.
     */
    static <T> Iterator<T> single(Supplier<T> supplier) {
        Objects.requireNonNull(supplier, "supplier");
        return new Lookahead<>() {
            private boolean consumed;

            @Override
            protected T computeNext() {
                if (consumed) {
                    return null;
                }
                consumed = true;
                return supplier.get();
            }
        };
    }

    /**
     * Returns {@code seed, step(seed), step(step(seed)), ...} while {@code admits} holds.
     */
    static <T> Iterator<T> iterate(T seed, UnaryOperator<T> step, Predicate<? super T> admits) {
        Objects.requireNonNull(step, "step");
        Objects.requireNonNull(admits, "admits");
        return new Lookahead<>() {
            private T current;
            private boolean started;

            @Override
            protected T computeNext() {
                current = started ? step.apply(current) : seed;
                started = true;
                return current != null && admits.test(current) ? current : null;
            }
        };
    }

    static <T> Iterator<T> filter(Iterator<T> source, Predicate<? super T> predicate) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(predicate, "predicate");
        return new Lookahead<>() {
            @Override
            protected T computeNext() {
                while (source.hasNext()) {
                    T candidate = source.next();
                    if (predicate.test(candidate)) {
                        return candidate;
                    }
                }
                return null;
            }
        };
    }

    /**
     * Maps each element; {@code null} mapper results are skipped.
     */
    static <T, R> Iterator<R> map(Iterator<T> source, Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mapper, "mapper");
        return new Lookahead<>() {
            @Override
            protected R computeNext() {
                while (source.hasNext()) {
                    R mapped = mapper.apply(source.next());
                    if (mapped != null) {
                        return mapped;
                    }
                }
                return null;
            }
        };
    }

    static <T> Iterator<T> takeWhile(Iterator<T> source, Predicate<? super T> predicate) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(predicate, "predicate");
        return new Lookahead<>() {
            private boolean stopped;

            @Override
            protected T computeNext() {
                if (stopped || !source.hasNext()) {
                    return null;
                }
                T candidate = source.next();
                if (!predicate.test(candidate)) {
                    stopped = true;
                    return null;
                }
                return candidate;
            }
        };
    }

    static <T, R> Iterator<R> flatMap(Iterator<T> source, Function<? super T, Iterator<R>> mapper) {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mapper, "mapper");
        return new Lookahead<>() {
            private Iterator<R> inner = Collections.emptyIterator();

            @Override
            protected R computeNext() {
                while (!inner.hasNext()) {
                    if (!source.hasNext()) {
                        return null;
                    }
                    inner = mapper.apply(source.next());
                }
                return inner.next();
            }
        };
    }

    /**
     * Returns {@code first} followed by the sequence from {@code second}, created only once {@code first} is drained.
     */
    static <T> Iterator<T> concat(Iterator<T> first, Supplier<Iterator<T>> second) {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
        return new Lookahead<>() {
            private Iterator<T> tail;

            @Override
            protected T computeNext() {
                if (first.hasNext()) {
                    return first.next();
                }
                if (tail == null) {
                    tail = second.get();
                }
                return tail.hasNext() ? tail.next() : null;
            }
        };
    }

    /**
     * Returns the sequence produced by {@code supplier}, created on first pull.
     */
    static <T> Iterator<T> defer(Supplier<Iterator<T>> supplier) {
        return concat(empty(), supplier);
    }

    /**
     * Drains a finite sequence and returns its elements in reverse order.
     */
    static <T> Iterator<T> reversed(Iterator<T> finite) {
        Deque<T> stack = new ArrayDeque<>();
        finite.forEachRemaining(stack::push);
        return stack.iterator();
    }

    /**
     * Iterator base computing one element ahead; {@link #computeNext()} returns {@code null} at the end.
     */
    abstract static class Lookahead<T> implements Iterator<T> {
        private T next;
        private boolean done;

        protected abstract T computeNext();

        @Override
        public final boolean hasNext() {
            if (next != null) {
                return true;
            }
            if (done) {
                return false;
            }
            next = computeNext();
            if (next == null) {
                done = true;
            }
            return next != null;
        }

        @Override
        public final T next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            T result = next;
            next = null;
            return result;
        }
    }
}
