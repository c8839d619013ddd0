package org.Aayush.ontology.constraint;

import org.Aayush.core.time.Grain;
import org.Aayush.core.time.Interval;
import org.Aayush.core.time.Moment;
import org.Aayush.core.time.MomentContext;

import java.util.Iterator;
import java.util.Objects;

/**
 * Candidates matching two constraints at once, for example "Monday the 13th" or "March 5th at 9am".
 *
 * <p>The coarser constraint is walked and, inside each of its candidates, the finer one.
 * Results are clipped to the coarse candidate. A result goes forward when it ends after the
 * reference start and backward otherwise.</p>
 */
record IntersectConstraint(TimeConstraint first, TimeConstraint second) implements TimeConstraint {

    IntersectConstraint {
        Objects.requireNonNull(first, "first");
        Objects.requireNonNull(second, "second");
    }

    @Override
    public Grain grain() {
        return Grain.finer(first.grain(), second.grain());
    }

    @Override
    public Walker toWalker(Interval reference, MomentContext context) {
        boolean secondIsCoarser = second.grain().isCoarserThan(first.grain());
        TimeConstraint coarse = secondIsCoarser ? second : first;
        TimeConstraint fine = secondIsCoarser ? first : second;
        Moment origin = reference.start();

        Iterator<Interval> forward = Candidates.filter(
                Candidates.flatMap(
                        coarse.toWalker(reference, context).forward(),
                        candidate -> within(candidate, fine, context)
                ),
                interval -> interval.endMoment().isAfter(origin)
        );

        // The coarse candidate containing the reference may hold fine candidates that already ended.
        Iterator<Interval> backward = Candidates.concat(
                Candidates.defer(() -> pastInHead(coarse, fine, reference, context)),
                () -> Candidates.flatMap(
                        coarse.toWalker(reference, context).backward(),
                        candidate -> Candidates.reversed(within(candidate, fine, context))
                )
        );
        return Walker.of(forward, backward);
    }

    private static Iterator<Interval> pastInHead(
            TimeConstraint coarse,
            TimeConstraint fine,
            Interval reference,
            MomentContext context
    ) {
        Iterator<Interval> coarseForward = coarse.toWalker(reference, context).forward();
        if (!coarseForward.hasNext()) {
            return Candidates.empty();
        }
        Interval head = coarseForward.next();
        Moment origin = reference.start();
        if (!head.start().isBefore(origin)) {
            return Candidates.empty();
        }
        return Candidates.reversed(Candidates.filter(
                within(head, fine, context),
                interval -> !interval.endMoment().isAfter(origin)
        ));
    }

    private static Iterator<Interval> within(Interval coarseCandidate, TimeConstraint fine, MomentContext context) {
        Moment limit = coarseCandidate.endMoment();
        Iterator<Interval> fineForward = fine
                .toWalker(Interval.startingAt(coarseCandidate.start(), fine.grain()), context)
                .forward();
        return Candidates.map(
                Candidates.takeWhile(fineForward, interval -> interval.start().isBefore(limit)),
                interval -> interval.intersect(coarseCandidate).orElse(null)
        );
    }
}
