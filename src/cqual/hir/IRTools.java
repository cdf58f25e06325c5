package cqual.hir;

import java.util.List;

/**
* <b>IRTools</b> provides tools that perform search and consistency checks on
* the IR tree.
*/
public final class IRTools {

    private IRTools() {
    }

    /**
    * Checks that every object below <b>t</b> is listed as a child of its
    * parent, by identity.
    *
    * @param t the root of the check.
    * @return true if the tree is consistent.
    */
    public static boolean checkConsistency(Traversable t) {
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        iter.next();
        while (iter.hasNext()) {
            Traversable tr = iter.next();
            Traversable p = tr.getParent();
            if (p == null || identityIndexOf(p.getChildren(), tr) < 0) {
                PrintTools.printlnStatus(0, "Affected IR =", tr);
                PrintTools.printlnStatus(0, "Affected parent =", p);
                return false;
            }
        }
        return true;
    }

    /**
    * Returns the position of an object in a list, comparing by identity.
    *
    * @param list the list to search.
    * @param o the object to look for.
    * @return the index, or -1.
    */
    public static int identityIndexOf(List<? extends Traversable> list,
                                      Traversable o) {
        for (int i = 0; i < list.size(); i++) {
            if (list.get(i) == o) {
                return i;
            }
        }
        return -1;
    }

    /**
    * Returns the nearest ancestor of <b>t</b> having the specified type.
    *
    * @param t the traversable object to start from.
    * @param type the IR type to be searched for.
    * @return the ancestor, or null if there is none.
    */
    @SuppressWarnings("unchecked")
    public static <T extends Traversable> T
            getAncestorOfType(Traversable t, Class<T> type) {
        if (t == null) {
            return null;
        }
        Traversable ret = t.getParent();
        while (ret != null && !type.isInstance(ret)) {
            ret = ret.getParent();
        }
        return (T)ret;
    }

}
