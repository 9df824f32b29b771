/*
 * Copyright 2013 University of Chicago and Argonne National Laboratory
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License
 */
package exm.fortx.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import exm.fortx.ir.Node;
import exm.fortx.ir.Statements.Import;

/**
 * Names declared in one file, module, routine or block construct.
 * Lookup tries local names, then names use-associated into this scope,
 * then the enclosing scope: an inner declaration hides an outer one
 * only inside the inner scope.
 */
public class Scope {
  /** Bounds chains of modules re-exporting each other */
  private static final int MAX_USE_DEPTH = 32;

  /**
   * A USE statement whose module is loaded
   */
  public static class UseAssociation {
    public final Import stmt;
    public final Scope module;

    public UseAssociation(Import stmt, Scope module) {
      this.stmt = stmt;
      this.module = module;
    }

    /**
     * @param local name in the using scope
     * @return name in the module, or null if this USE doesn't make
     *         the name visible
     */
    public String remoteName(String local) {
      boolean renamed = false;
      for (String sym: stmt.symbols()) {
        if (Import.localName(sym).equalsIgnoreCase(local)) {
          return Import.remoteName(sym);
        }
        if (Import.remoteName(sym).equalsIgnoreCase(local) &&
            sym.contains("=>")) {
          renamed = true;
        }
      }
      if (stmt.isOnly() || renamed) {
        return null;
      }
      return local;
    }
  }

  private final ScopeKind kind;
  private final String name;
  private final Scope parent;
  private final Node node;
  private final Map<String, Symbol> symbols =
                        new ConcurrentHashMap<String, Symbol>();
  private final List<UseAssociation> uses =
                        new CopyOnWriteArrayList<UseAssociation>();
  /** Modules used without ONLY that are not loaded */
  private final List<String> unloadedModules =
                        new CopyOnWriteArrayList<String>();

  public Scope(ScopeKind kind, String name, Scope parent, Node node) {
    this.kind = kind;
    this.name = name.toLowerCase();
    this.parent = parent;
    this.node = node;
  }

  public ScopeKind kind() {
    return kind;
  }

  public String name() {
    return name;
  }

  /** @return enclosing scope, null for a file scope */
  public Scope parent() {
    return parent;
  }

  /** @return the file, module, routine or block node */
  public Node node() {
    return node;
  }

  /**
   * Add or replace a local symbol
   */
  public void define(Symbol symbol) {
    symbols.put(symbol.name(), symbol);
  }

  public void addUse(UseAssociation use) {
    uses.add(use);
  }

  public void addUnloadedModule(String module) {
    unloadedModules.add(module.toLowerCase());
  }

  public List<UseAssociation> uses() {
    return Collections.unmodifiableList(uses);
  }

  public Symbol lookupLocal(String n) {
    return symbols.get(n.toLowerCase());
  }

  public List<Symbol> localSymbols() {
    List<Symbol> result = new ArrayList<Symbol>(symbols.values());
    Collections.sort(result, new Comparator<Symbol>() {
      @Override
      public int compare(Symbol a, Symbol b) {
        return a.name().compareTo(b.name());
      }
    });
    return result;
  }

  /**
   * @return visible symbol, or null if the name isn't declared in this
   *         or any enclosing scope
   */
  public Symbol lookup(String n) {
    String key = n.toLowerCase();
    for (Scope s = this; s != null; s = s.parent) {
      Symbol sym = s.lookupHere(key, 0);
      if (sym != null) {
        return sym;
      }
    }
    return null;
  }

  /**
   * Local names and use-associated names, not enclosing scopes
   */
  private Symbol lookupHere(String key, int depth) {
    Symbol sym = symbols.get(key);
    if (sym != null || depth > MAX_USE_DEPTH) {
      return sym;
    }
    for (UseAssociation use: uses) {
      String remote = use.remoteName(key);
      if (remote != null) {
        sym = use.module.lookupHere(remote.toLowerCase(), depth + 1);
        if (sym != null) {
          return sym;
        }
      }
    }
    return null;
  }

  /**
   * @return first module used without ONLY that isn't loaded, searching
   *         outward, or null
   */
  public String unloadedModule() {
    for (Scope s = this; s != null; s = s.parent) {
      if (!s.unloadedModules.isEmpty()) {
        return s.unloadedModules.get(0);
      }
    }
    return null;
  }

  /**
   * @return true if this scope is s or nested inside it
   */
  public boolean isWithin(Scope s) {
    for (Scope curr = this; curr != null; curr = curr.parent) {
      if (curr == s) {
        return true;
      }
    }
    return false;
  }

  @Override
  public String toString() {
    return kind.toString().toLowerCase() + " " + name;
  }
}
