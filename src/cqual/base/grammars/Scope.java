package cqual.base.grammars;

import cqual.hir.Symbol;
import cqual.hir.TypeStructure;

import java.util.HashMap;
import java.util.Map;

/**
* One level of C name lookup used while parsing. Ordinary names map to a
* {@link Symbol}, to the {@link TypeStructure} of a typedef, or to
* {@link #ENUMERATOR}; tags map to a record or to {@link #ENUM_TAG}.
*/
class Scope
{
  /** Marker for enumeration constants. */
  static final Object ENUMERATOR = new Object();

  /** Marker for enum tags. */
  static final Object ENUM_TAG = new Object();

  private final Scope parent;

  private final Map<String, Object> names = new HashMap<String, Object>();

  private final Map<String, Object> tags = new HashMap<String, Object>();

  Scope(Scope parent)
  {
    this.parent = parent;
  }

  Scope getParent()
  {
    return parent;
  }

  boolean isFileScope()
  {
    return (parent == null);
  }

  /** Looks up an ordinary name from the innermost scope outwards. */
  Object lookup(String name)
  {
    for (Scope s = this; s != null; s = s.parent) {
      Object o = s.names.get(name);
      if (o != null)
        return o;
    }
    return null;
  }

  Object getLocal(String name)
  {
    return names.get(name);
  }

  /** Returns the type behind a visible typedef name, or null. */
  TypeStructure lookupTypedef(String name)
  {
    Object o = lookup(name);
    return (o instanceof TypeStructure) ? (TypeStructure)o : null;
  }

  void putSymbol(String name, Symbol symbol)
  {
    names.put(name, symbol);
  }

  void putTypedef(String name, TypeStructure type)
  {
    names.put(name, type);
  }

  void putEnumerator(String name)
  {
    names.put(name, ENUMERATOR);
  }

  Object lookupTag(String tag)
  {
    for (Scope s = this; s != null; s = s.parent) {
      Object o = s.tags.get(tag);
      if (o != null)
        return o;
    }
    return null;
  }

  Object getLocalTag(String tag)
  {
    return tags.get(tag);
  }

  void putTag(String tag, Object value)
  {
    tags.put(tag, value);
  }
}
