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
package exm.scad.ast;

import java.util.List;
import java.util.Objects;

import com.google.common.collect.ImmutableList;

/**
 * Unit of a file or block body: a definition, a variable declaration
 * or a statement.
 */
public abstract class Item extends Node {

  public static enum ItemKind {
    MODULE_DEF, FUNCTION_DEF, VAR_DECL, STATEMENT,
  }

  protected Item(Span span) {
    super(span);
  }

  public abstract ItemKind kind();

  @Override
  public String toString() {
    return AstPrinter.printItem(this).trim();
  }

  /**
   * module name(params) body.  A braced body is flattened into its items;
   * any other body becomes a single statement item.
   */
  public static class ModuleDef extends Item {
    private final Name name;
    private final List<Param> params;
    private final List<Item> body;

    public ModuleDef(Name name, List<Param> params, List<Item> body,
                     Span span) {
      super(span);
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public ItemKind kind() {
      return ItemKind.MODULE_DEF;
    }

    public Name getName() {
      return name;
    }

    public List<Param> getParams() {
      return params;
    }

    public List<Item> getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), name, params, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof ModuleDef))
        return false;
      ModuleDef other = (ModuleDef) obj;
      return name.equals(other.name) && params.equals(other.params) &&
             body.equals(other.body);
    }
  }

  /**
   * function name(params) = body;
   */
  public static class FunctionDef extends Item {
    private final Name name;
    private final List<Param> params;
    private final Expr body;

    public FunctionDef(Name name, List<Param> params, Expr body, Span span) {
      super(span);
      this.name = name;
      this.params = ImmutableList.copyOf(params);
      this.body = body;
    }

    @Override
    public ItemKind kind() {
      return ItemKind.FUNCTION_DEF;
    }

    public Name getName() {
      return name;
    }

    public List<Param> getParams() {
      return params;
    }

    public Expr getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), name, params, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof FunctionDef))
        return false;
      FunctionDef other = (FunctionDef) obj;
      return name.equals(other.name) && params.equals(other.params) &&
             body.equals(other.body);
    }
  }

  public static class VarDecl extends Item {
    private final Name name;
    private final Expr value;

    public VarDecl(Name name, Expr value, Span span) {
      super(span);
      this.name = name;
      this.value = value;
    }

    @Override
    public ItemKind kind() {
      return ItemKind.VAR_DECL;
    }

    public Name getName() {
      return name;
    }

    public Expr getValue() {
      return value;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), name, value);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof VarDecl))
        return false;
      VarDecl other = (VarDecl) obj;
      return name.equals(other.name) && value.equals(other.value);
    }
  }

  /**
   * Statement in item position
   */
  public static class Statement extends Item {
    private final Stmt stmt;

    public Statement(Stmt stmt) {
      super(stmt.getSpan());
      this.stmt = stmt;
    }

    @Override
    public ItemKind kind() {
      return ItemKind.STATEMENT;
    }

    public Stmt getStmt() {
      return stmt;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), stmt);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Statement && stmt.equals(((Statement)obj).stmt);
    }
  }
}
