package cqual.hir;

import java.io.PrintWriter;

/**
* Wraps a declaration that appears inside a block.
*/
public class DeclarationStatement extends Statement {

    public DeclarationStatement(Declaration decl) {
        super(1);
        addChild(decl);
    }

    public Declaration getDeclaration() {
        return (Declaration)children.get(0);
    }

    public void print(PrintWriter o) {
        getDeclaration().print(o);
    }

}
