package plainconfig;

import lombok.EqualsAndHashCode;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

@EqualsAndHashCode
public final class Tuple implements Iterable<Object> {

    private static final Tuple EMPTY = new Tuple(Collections.emptyList());

    private final List<Object> items;

    private Tuple(List<Object> items) {
        this.items = items;
    }

    public static Tuple of(Object... items) {
        if (items == null || items.length == 0) {
            return EMPTY;
        }
        return new Tuple(Collections.unmodifiableList(new ArrayList<>(Arrays.asList(items))));
    }

    public static Tuple copyOf(Collection<?> items) {
        if (items == null || items.isEmpty()) {
            return EMPTY;
        }
        return new Tuple(Collections.unmodifiableList(new ArrayList<>(items)));
    }

    public Object get(int index) {
        return items.get(index);
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public List<Object> asList() {
        return items;
    }

    @Override
    public Iterator<Object> iterator() {
        return items.iterator();
    }

    @Override
    public String toString() {
        return Literals.repr(this);
    }
}
