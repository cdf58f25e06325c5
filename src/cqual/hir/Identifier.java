package cqual.hir;

import java.io.PrintWriter;

/**
* <b>Identifier</b> represents a name used in an expression. An identifier
* that names a variable, parameter, field or function is linked to its
* {@link Symbol}; identifiers naming enumerators or undeclared functions have
* no symbol.
*/
public class Identifier extends Expression {

    private String name;

    /** Reference to the relevant symbol object. */
    private Symbol symbol;

    /**
    * Constructs an identifier with the given name and resolved symbol.
    *
    * @param name the written name.
    * @param symbol the symbol, or null if the name is not a symbol.
    */
    public Identifier(String name, Symbol symbol) {
        super(-1);
        this.name = name;
        this.symbol = symbol;
    }

    /** Returns the written name. */
    public String getName() {
        return name;
    }

    /**
    * Returns the linked symbol.
    *
    * @return the symbol, or null if the name does not denote a symbol.
    */
    public Symbol getSymbol() {
        return symbol;
    }

    protected void printExpression(PrintWriter o) {
        o.print(name);
    }

}
