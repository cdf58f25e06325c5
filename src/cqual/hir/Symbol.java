package cqual.hir;

/**
* Represents a declared entity that may receive a type qualifier: a variable,
* parameter, struct or union field, or function (through its return slot).
* Symbols are ordered by id, which follows declaration order.
*/
public interface Symbol {

    /** Returns the id that is unique within the program. */
    int getId();

    /**
    * Returns the declared name.
    *
    * @return the name, which is empty for an unnamed parameter.
    */
    String getSymbolName();

    /** Returns the full written type of the symbol. */
    TypeStructure getTypeStructure();

    /** Returns the enclosing declaration. */
    Declaration getDeclaration();

    /** Returns the line of the declared name. */
    int getLine();

    /** Checks if the symbol is declared in the file being rewritten. */
    boolean isInPrimaryFile();

    /**
    * Returns an earlier declaration of the same entity.
    *
    * @return the earlier declarator, or null.
    */
    Symbol getPreviousDeclaration();

}
