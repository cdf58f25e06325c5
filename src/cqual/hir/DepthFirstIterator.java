package cqual.hir;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;
import java.util.NoSuchElementException;

/**
* Iterates over Traversable objects in depth-first pre-order, which is source
* order for the IR built by the parser. Null children are skipped.
*/
public class DepthFirstIterator<E extends Traversable> extends IRIterator<E> {

    private LinkedList<Traversable> stack;

    private List<Class<? extends Traversable>> prune_list;

    /**
    * Creates a new iterator starting at the given object.
    *
    * @param init The first object to visit.
    */
    public DepthFirstIterator(Traversable init) {
        super(init);
        stack = new LinkedList<Traversable>();
        stack.add(init);
        prune_list = new ArrayList<Class<? extends Traversable>>(4);
    }

    public boolean hasNext() {
        return !stack.isEmpty();
    }

    @SuppressWarnings("unchecked")
    public E next() {
        if (stack.isEmpty()) {
            throw new NoSuchElementException();
        }
        Traversable t = stack.removeFirst();
        if (t.getChildren() != null && !needsPruning(t.getClass())) {
            List<Traversable> children = t.getChildren();
            for (int j = children.size() - 1; j >= 0; j--) {
                Traversable child = children.get(j);
                if (child != null) {
                    stack.addFirst(child);
                }
            }
        }
        return (E)t;
    }

    private boolean needsPruning(Class<? extends Traversable> c) {
        for (int i = 0; i < prune_list.size(); i++) {
            if (prune_list.get(i).isAssignableFrom(c)) {
                return true;
            }
        }
        return false;
    }

    /**
    * Disables traversal below objects of the specified type. The objects
    * themselves are still visited.
    *
    * @param c the object type to be pruned on.
    */
    public void pruneOn(Class<? extends Traversable> c) {
        prune_list.add(c);
    }

    /**
    * Returns the remaining objects of class c in iteration order.
    *
    * @param c the object type to be collected.
    * @return the collected list.
    */
    @SuppressWarnings("unchecked")
    public <T extends Traversable> List<T> getList(Class<T> c) {
        List<T> ret = new ArrayList<T>();
        while (hasNext()) {
            Object o = next();
            if (c.isInstance(o)) {
                ret.add((T)o);
            }
        }
        return ret;
    }

}
