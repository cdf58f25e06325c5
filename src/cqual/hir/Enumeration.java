package cqual.hir;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;

/** Represents an enum definition. Enumerators are not symbols. */
public class Enumeration extends Declaration {

    private String name;

    private List<String> enumerators;

    public Enumeration(String name, List<String> enumerators) {
        super(-1);
        this.name = name;
        this.enumerators = new ArrayList<String>(enumerators);
    }

    /** Returns the tag, or null. */
    public String getName() {
        return name;
    }

    public List<String> getEnumerators() {
        return enumerators;
    }

    public void print(PrintWriter o) {
        o.print("enum ");
        if (name != null) {
            o.print(name);
            o.print(" ");
        }
        o.print("{");
        for (int i = 0; i < enumerators.size(); i++) {
            o.print(i == 0 ? " " : ", ");
            o.print(enumerators.get(i));
        }
        o.print(" };");
    }

}
