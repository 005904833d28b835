package alpha.emitter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

import static java.util.Objects.requireNonNull;

/**
 * An immutable and ordered collection of registrations for one event.<p>
 *
 * Most events have just one listener, in which case the bucket is a
 * {@code Single}, which holds the registration without a backing collection.
 * Buckets of two or more registrations are a {@code Many}. An empty bucket
 * does not exist; the modifying methods return {@code null} instead.<p>
 *
 * Modifying methods return a new bucket and leave the current one untouched.
 * The emitter replaces the bucket in its map, and an emission in progress keeps
 * iterating the bucket it started with.
 */
abstract class Bucket
{
    /**
     * Creates a bucket of one registration.
     *
     * @param first registration
     *
     * @return a new bucket
     *
     * @throws NullPointerException if {@code first} is {@code null}
     */
    static Bucket of(Registration first) {
        return new Single(requireNonNull(first));
    }

    private Bucket() {
        // Only the nested implementations
    }

    /**
     * Returns the number of registrations.
     *
     * @return the number of registrations (at least 1)
     */
    abstract int size();

    /**
     * Returns all registrations in registration order.
     *
     * @return all registrations in registration order (unmodifiable)
     */
    abstract List<Registration> asList();

    /**
     * Returns a bucket with the given registration appended.
     *
     * @param r registration to append
     *
     * @return a new bucket
     *
     * @throws NullPointerException if {@code r} is {@code null}
     */
    abstract Bucket add(Registration r);

    /**
     * Returns a bucket without the registrations matched by the given filter.
     *
     * @param filter of registrations to remove
     *
     * @return this bucket if nothing was removed,
     *         otherwise a new bucket of the survivors in their current order,
     *         or {@code null} if all were removed
     */
    abstract Bucket removeIf(Predicate<? super Registration> filter);

    /**
     * Returns a bucket without the given registration.
     *
     * @param r registration to remove (reference identity)
     *
     * @return see {@link #removeIf(Predicate)}
     */
    final Bucket remove(Registration r) {
        return removeIf(x -> x == r);
    }

    private static final class Single extends Bucket {
        private final Registration only;

        Single(Registration only) {
            this.only = only;
        }

        @Override
        int size() {
            return 1;
        }

        @Override
        List<Registration> asList() {
            return List.of(only);
        }

        @Override
        Bucket add(Registration r) {
            return new Many(new Registration[]{only, requireNonNull(r)});
        }

        @Override
        Bucket removeIf(Predicate<? super Registration> filter) {
            return filter.test(only) ? null : this;
        }
    }

    private static final class Many extends Bucket {
        private final Registration[] all;

        Many(Registration[] all) {
            assert all.length > 1;
            this.all = all;
        }

        @Override
        int size() {
            return all.length;
        }

        @Override
        List<Registration> asList() {
            return Collections.unmodifiableList(Arrays.asList(all));
        }

        @Override
        Bucket add(Registration r) {
            requireNonNull(r);
            var grown = Arrays.copyOf(all, all.length + 1);
            grown[all.length] = r;
            return new Many(grown);
        }

        @Override
        Bucket removeIf(Predicate<? super Registration> filter) {
            var keep = new ArrayList<Registration>(all.length);
            for (Registration r : all) {
                if (!filter.test(r)) {
                    keep.add(r);
                }
            }
            switch (keep.size()) {
                case 0:
                    return null;
                case 1:
                    return new Single(keep.get(0));
                default:
                    return keep.size() == all.length ? this :
                            new Many(keep.toArray(Registration[]::new));
            }
        }
    }
}
