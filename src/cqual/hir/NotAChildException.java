package cqual.hir;

/**
* Thrown when an object is told its parent is an object that does not list
* it as a child.
*/
public class NotAChildException extends RuntimeException {

    private static final long serialVersionUID = 1;

    public NotAChildException() {
        super();
    }

    public NotAChildException(String message) {
        super(message);
    }

}
