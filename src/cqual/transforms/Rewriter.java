package cqual.transforms;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
* Accumulates text insertions against an unchanged original text. Offsets
* always refer to the original, so insertions can be recorded in any order;
* insertions at the same offset are emitted in the order they were made.
*/
public class Rewriter {

    private final String original;

    private final TreeMap<Integer, List<String>> insertions;

    /**
    * Creates a rewriter over the given text.
    *
    * @param original the text to be rewritten.
    */
    public Rewriter(String original) {
        this.original = original;
        insertions = new TreeMap<Integer, List<String>>();
    }

    /**
    * Records an insertion before the character at <b>offset</b>.
    *
    * @param offset a position in the original text, from 0 to its length.
    * @param text the text to insert.
    * @throws IndexOutOfBoundsException if the offset is outside the text.
    */
    public void insertText(int offset, String text) {
        if (offset < 0 || offset > original.length()) {
            throw new IndexOutOfBoundsException("offset " + offset +
                    " outside text of length " + original.length());
        }
        List<String> at = insertions.get(offset);
        if (at == null) {
            at = new ArrayList<String>(1);
            insertions.put(offset, at);
        }
        at.add(text);
    }

    /** Returns the number of recorded insertions. */
    public int getEditCount() {
        int count = 0;
        for (List<String> at : insertions.values()) {
            count += at.size();
        }
        return count;
    }

    /** Returns the original text with all insertions applied. */
    public String getRewrittenText() {
        StringBuilder sb = new StringBuilder(original.length() +
                                             16 * insertions.size());
        int pos = 0;
        for (Map.Entry<Integer, List<String>> entry : insertions.entrySet()) {
            sb.append(original, pos, entry.getKey());
            for (String text : entry.getValue()) {
                sb.append(text);
            }
            pos = entry.getKey();
        }
        sb.append(original, pos, original.length());
        return sb.toString();
    }

}
