package cqual.hir;

import java.util.List;

/**
* Any class implementing this interface can act as a tree node by providing
* access to its children and parent.
*/
public interface Traversable extends Printable {

    /**
    * Provides access to the children of this object as a list. Null entries
    * stand for optional parts that are absent, for example the missing
    * condition of a <b>for</b> loop.
    *
    * @return the children as a list.
    */
    List<Traversable> getChildren();

    /**
    * Provides access to the parent of this object. Every IR object has at most
    * one parent, which is the enclosing object in the parse tree.
    *
    * @return the parent of this object.
    */
    Traversable getParent();

    /**
    * Sets the parent of this object. The parent must already consider this
    * object a child.
    *
    * @param t the new parent.
    * @throws NotAChildException if <b>t</b> does not list this object.
    */
    void setParent(Traversable t);

}
