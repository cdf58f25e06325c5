package cqual.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* <b>SymbolTools</b> provides tools for collecting symbols and for reasoning
* about the types of declarations and expressions.
*/
public final class SymbolTools {

    private SymbolTools() {
    }

    /**
    * Collects every symbol under the given IR object in declaration order.
    * Typedef declarators are not symbols and are left out.
    *
    * @param t the root of the search, usually the program.
    * @return the symbols in source order.
    */
    public static List<Symbol> getSymbols(Traversable t) {
        List<Symbol> ret = new ArrayList<Symbol>();
        DepthFirstIterator<Traversable> iter =
                new DepthFirstIterator<Traversable>(t);
        iter.pruneOn(Expression.class);
        while (iter.hasNext()) {
            Traversable o = iter.next();
            if (o instanceof VariableDeclarator &&
                !((VariableDeclarator)o).isTypedef()) {
                ret.add((Symbol)o);
            }
        }
        return ret;
    }

    /**
    * Collects the symbols with the given name in declaration order.
    *
    * @param t the root of the search.
    * @param name the name to look for.
    * @return the matching symbols, possibly empty.
    */
    public static List<Symbol> getSymbolsByName(Traversable t, String name) {
        List<Symbol> ret = new ArrayList<Symbol>(2);
        for (Symbol symbol : getSymbols(t)) {
            if (symbol.getSymbolName().equals(name)) {
                ret.add(symbol);
            }
        }
        return ret;
    }

    /**
    * Replaces typedef names by the types they stand for, repeatedly.
    *
    * @param type the type, may be null.
    * @return the type with no typedef at its outermost layer.
    */
    public static TypeStructure resolveTypedef(TypeStructure type) {
        while (type instanceof TypeStructure.Base &&
               ((TypeStructure.Base)type).getTypedefType() != null) {
            type = ((TypeStructure.Base)type).getTypedefType();
        }
        return type;
    }

    /**
    * Returns the type reached from a declaration type after the given number
    * of pointer or array layers, seeing through typedefs. A function type
    * stands for its return type at every level.
    *
    * @param type the declared type.
    * @param level the number of layers to strip.
    * @return the resolved type at that level, or null if the type has fewer
    *   layers or the level is negative.
    */
    public static TypeStructure getTypeAtLevel(TypeStructure type, int level) {
        if (level < 0) {
            return null;
        }
        TypeStructure t = resolveTypedef(type);
        if (t != null && t.getKind() == TypeStructure.Kind.FUNCTION) {
            t = resolveTypedef(t.getInner());
        }
        while (t != null && level > 0) {
            TypeStructure.Kind kind = t.getKind();
            if (kind != TypeStructure.Kind.POINTER &&
                kind != TypeStructure.Kind.ARRAY) {
                return null;
            }
            t = resolveTypedef(t.getInner());
            level--;
        }
        return t;
    }

    /**
    * Returns the struct or union a type names.
    *
    * @param type the type, may be null.
    * @return the record, or null if the type is not a record type.
    */
    public static ClassDeclaration getRecord(TypeStructure type) {
        TypeStructure t = resolveTypedef(type);
        if (t instanceof TypeStructure.Base) {
            return ((TypeStructure.Base)t).getRecord();
        }
        return null;
    }

    /**
    * Returns the type an expression designates after one dereference.
    *
    * @param type the operand type.
    * @return the pointee or element type, a function type for itself, or null.
    */
    public static TypeStructure getPointeeType(TypeStructure type) {
        TypeStructure t = resolveTypedef(type);
        if (t == null) {
            return null;
        }
        switch (t.getKind()) {
        case POINTER:
        case ARRAY:
            return t.getInner();
        case FUNCTION:
            return t;
        default:
            return null;
        }
    }

    /**
    * Computes the static type of an expression as far as it matters for
    * resolving member accesses. Arithmetic results are not typed.
    *
    * @param e the expression.
    * @return the type, or null if unknown.
    */
    public static TypeStructure getExpressionType(Expression e) {
        if (e instanceof Identifier) {
            Symbol symbol = ((Identifier)e).getSymbol();
            return (symbol == null) ? null : symbol.getTypeStructure();
        } else if (e instanceof AccessExpression) {
            return getExpressionType(((AccessExpression)e).getMember());
        } else if (e instanceof UnaryExpression) {
            UnaryExpression ue = (UnaryExpression)e;
            UnaryOperator op = ue.getOperator();
            TypeStructure operand = getExpressionType(ue.getExpression());
            if (op == UnaryOperator.DEREFERENCE) {
                return getPointeeType(operand);
            } else if (op == UnaryOperator.ADDRESS_OF) {
                if (operand == null) {
                    return null;
                }
                List<String> quals = Collections.emptyList();
                return new TypeStructure.Pointer(operand, quals, -1);
            } else if (op == UnaryOperator.PRE_INCREMENT ||
                       op == UnaryOperator.PRE_DECREMENT ||
                       op == UnaryOperator.POST_INCREMENT ||
                       op == UnaryOperator.POST_DECREMENT) {
                return operand;
            }
            return null;
        } else if (e instanceof ArrayAccess) {
            return getPointeeType(
                    getExpressionType(((ArrayAccess)e).getArrayName()));
        } else if (e instanceof FunctionCall) {
            TypeStructure t = resolveTypedef(
                    getExpressionType(((FunctionCall)e).getName()));
            if (t != null && t.getKind() == TypeStructure.Kind.POINTER) {
                t = resolveTypedef(t.getInner());
            }
            if (t != null && t.getKind() == TypeStructure.Kind.FUNCTION) {
                return t.getInner();
            }
            return null;
        } else if (e instanceof Typecast) {
            return ((Typecast)e).getType();
        } else if (e instanceof CompoundLiteral) {
            return ((CompoundLiteral)e).getType();
        } else if (e instanceof ConditionalExpression) {
            ConditionalExpression ce = (ConditionalExpression)e;
            TypeStructure t = getExpressionType(ce.getTrueExpression());
            return (t != null) ? t :
                    getExpressionType(ce.getFalseExpression());
        } else if (e instanceof AssignmentExpression) {
            return getExpressionType(((AssignmentExpression)e).getLHS());
        } else if (e instanceof CommaExpression) {
            List<Traversable> children = e.getChildren();
            return getExpressionType(
                    (Expression)children.get(children.size() - 1));
        } else if (e instanceof BinaryExpression) {
            // pointer arithmetic keeps the pointer operand's type
            BinaryExpression be = (BinaryExpression)e;
            BinaryOperator op = be.getOperator();
            if (op == BinaryOperator.ADD || op == BinaryOperator.SUBTRACT) {
                TypeStructure lhs = getExpressionType(be.getLHS());
                if (isPointerLike(lhs)) {
                    return lhs;
                }
                TypeStructure rhs = getExpressionType(be.getRHS());
                if (op == BinaryOperator.ADD && isPointerLike(rhs)) {
                    return rhs;
                }
            }
            return null;
        }
        return null;
    }

    private static boolean isPointerLike(TypeStructure type) {
        TypeStructure t = resolveTypedef(type);
        return (t != null && (t.getKind() == TypeStructure.Kind.POINTER ||
                              t.getKind() == TypeStructure.Kind.ARRAY));
    }

}
