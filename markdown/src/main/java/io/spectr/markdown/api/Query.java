package io.spectr.markdown.api;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Predicate;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Lazy sequence of the nodes of a document that match a compiled selector, in document order.
 *
 * <p>Each call to {@link #iterator()} starts a fresh pre-order walk, so a query can be iterated
 * any number of times.
 */
public final class Query implements Iterable<NodeHandle> {
    private final Document document;
    private final Predicate<NodeHandle> matcher;

    Query(Document document, Predicate<NodeHandle> matcher) {
        this.document = document;
        this.matcher = matcher;
    }

    @Override
    public Iterator<NodeHandle> iterator() {
        return new Iterator<>() {
            private final Deque<NodeHandle> pending = new ArrayDeque<>(List.of(document.root()));
            private NodeHandle next;

            @Override
            public boolean hasNext() {
                while (next == null && !pending.isEmpty()) {
                    NodeHandle node = pending.pop();
                    int count = node.childCount();
                    for (int i = count - 1; i >= 0; i--) {
                        pending.push(node.child(i));
                    }
                    if (matcher.test(node)) {
                        next = node;
                    }
                }
                return next != null;
            }

            @Override
            public NodeHandle next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                NodeHandle result = next;
                next = null;
                return result;
            }
        };
    }

    public Stream<NodeHandle> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    public Optional<NodeHandle> first() {
        Iterator<NodeHandle> it = iterator();
        return it.hasNext() ? Optional.of(it.next()) : Optional.empty();
    }

    public long count() {
        long n = 0;
        for (Iterator<NodeHandle> it = iterator(); it.hasNext(); it.next()) {
            n++;
        }
        return n;
    }

    public List<NodeHandle> toList() {
        List<NodeHandle> out = new ArrayList<>();
        forEach(out::add);
        return out;
    }
}
