package cqual.hir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
* Structural view of a written C type, outermost layer first. Every layer
* records the source offset just past the token that ends it, which is where a
* qualifier for that layer is inserted:
* <ul>
* <li>BASE - the last specifier or qualifier token, or the closing brace of an
*   inline struct, union or enum body</li>
* <li>POINTER - the '*'</li>
* <li>ARRAY - the ']'</li>
* <li>FUNCTION - the ')' closing the parameter list</li>
* </ul>
*/
public abstract class TypeStructure {

    /** The layer kinds. */
    public enum Kind {
        BASE, POINTER, ARRAY, FUNCTION
    }

    private final int end_offset;

    protected TypeStructure(int end_offset) {
        this.end_offset = end_offset;
    }

    /** Returns the kind of the outermost layer. */
    public abstract Kind getKind();

    /** Returns the offset just past the token ending this layer. */
    public int getEndOffset() {
        return end_offset;
    }

    /**
    * Returns the next layer: the pointee, the element type or the return type.
    *
    * @return the inner layer, or null for a base type.
    */
    public TypeStructure getInner() {
        return null;
    }

    /** A builtin, record, enum or typedef type. */
    public static class Base extends TypeStructure {

        private final String specifiers;

        private final ClassDeclaration record;

        private final String typedef_name;

        private final TypeStructure typedef_type;

        /**
        * Creates a base layer.
        *
        * @param specifiers the type specifier text as written.
        * @param record the named struct or union, or null.
        * @param typedef_name the typedef name used, or null.
        * @param typedef_type the type the typedef stands for, or null.
        * @param end_offset the insertion offset.
        */
        public Base(String specifiers, ClassDeclaration record,
                    String typedef_name, TypeStructure typedef_type,
                    int end_offset) {
            super(end_offset);
            this.specifiers = specifiers;
            this.record = record;
            this.typedef_name = typedef_name;
            this.typedef_type = typedef_type;
        }

        public Kind getKind() {
            return Kind.BASE;
        }

        public String getSpecifiers() {
            return specifiers;
        }

        /** Returns the struct or union named by this layer, or null. */
        public ClassDeclaration getRecord() {
            return record;
        }

        /** Returns the typedef name, or null. */
        public String getTypedefName() {
            return typedef_name;
        }

        /** Returns the type behind the typedef name, or null. */
        public TypeStructure getTypedefType() {
            return typedef_type;
        }

        @Override
        public String toString() {
            return specifiers;
        }
    }

    /** A pointer to the inner type. */
    public static class Pointer extends TypeStructure {

        private final TypeStructure pointee;

        private final List<String> qualifiers;

        public Pointer(TypeStructure pointee, List<String> qualifiers,
                       int end_offset) {
            super(end_offset);
            this.pointee = pointee;
            this.qualifiers = new ArrayList<String>(qualifiers);
        }

        public Kind getKind() {
            return Kind.POINTER;
        }

        @Override
        public TypeStructure getInner() {
            return pointee;
        }

        /** Returns the qualifiers written after the '*'. */
        public List<String> getQualifiers() {
            return Collections.unmodifiableList(qualifiers);
        }

        @Override
        public String toString() {
            return "pointer to " + pointee;
        }
    }

    /** An array of the inner type. */
    public static class Array extends TypeStructure {

        private final TypeStructure element;

        private final String size;

        public Array(TypeStructure element, String size, int end_offset) {
            super(end_offset);
            this.element = element;
            this.size = size;
        }

        public Kind getKind() {
            return Kind.ARRAY;
        }

        @Override
        public TypeStructure getInner() {
            return element;
        }

        /** Returns the size text, which is empty for an unsized array. */
        public String getSize() {
            return size;
        }

        @Override
        public String toString() {
            return "array[" + size + "] of " + element;
        }
    }

    /** A function returning the inner type. */
    public static class Function extends TypeStructure {

        private final TypeStructure return_type;

        private final List<TypeStructure> params;

        private final boolean variadic;

        public Function(TypeStructure return_type, List<TypeStructure> params,
                        boolean variadic, int end_offset) {
            super(end_offset);
            this.return_type = return_type;
            this.params = new ArrayList<TypeStructure>(params);
            this.variadic = variadic;
        }

        public Kind getKind() {
            return Kind.FUNCTION;
        }

        @Override
        public TypeStructure getInner() {
            return return_type;
        }

        /** Returns the parameter types; these are never descended into. */
        public List<TypeStructure> getParameterTypes() {
            return Collections.unmodifiableList(params);
        }

        public boolean isVariadic() {
            return variadic;
        }

        @Override
        public String toString() {
            return "function returning " + return_type;
        }
    }

}
