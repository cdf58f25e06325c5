package cqual.hir;

/**
* Thrown when an object that already has a parent is added as the child of
* another object.
*/
public class NotAnOrphanException extends RuntimeException {

    private static final long serialVersionUID = 1;

    public NotAnOrphanException() {
        super();
    }

    public NotAnOrphanException(String message) {
        super(message);
    }

}
