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
 * Statement nodes: anything that can produce or scope geometry.
 */
public abstract class Stmt extends Node {

  public static enum StmtKind {
    TRANSFORM_CHAIN, UNION_BLOCK,
    FOR, INTERSECTION_FOR, IF, LET, ASSIGN,
    INCLUDE, USE, ASSERT, EMPTY,
  }

  /**
   * Prefix characters that change how a module call is rendered
   */
  public static enum Modifier {
    ROOT("!"), DEBUG("#"), BACKGROUND("%"), DISABLE("*");

    private final String symbol;

    private Modifier(String symbol) {
      this.symbol = symbol;
    }

    public String symbol() {
      return symbol;
    }

    /**
     * @return the modifier, or null if the symbol is not one
     */
    public static Modifier fromSymbol(String symbol) {
      for (Modifier m: values()) {
        if (m.symbol.equals(symbol)) {
          return m;
        }
      }
      return null;
    }
  }

  protected Stmt(Span span) {
    super(span);
  }

  public abstract StmtKind kind();

  @Override
  public String toString() {
    return AstPrinter.printStmt(this);
  }

  /**
   * A named module call applied to whatever follows it.
   *
   * Primitives, transforms, boolean operations and user modules all share
   * this shape and differ only in their tail: Empty for a call ended by a
   * semicolon, a UnionBlock for a braced child list, or any other single
   * statement.
   */
  public static class TransformChain extends Stmt {
    private final List<Modifier> modifiers;
    private final Name name;
    private final List<Arg> args;
    private final Stmt tail;

    public TransformChain(List<Modifier> modifiers, Name name, List<Arg> args,
                          Stmt tail, Span span) {
      super(span);
      this.modifiers = ImmutableList.copyOf(modifiers);
      this.name = name;
      this.args = ImmutableList.copyOf(args);
      this.tail = tail;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.TRANSFORM_CHAIN;
    }

    public List<Modifier> getModifiers() {
      return modifiers;
    }

    public Name getName() {
      return name;
    }

    public List<Arg> getArgs() {
      return args;
    }

    public Stmt getTail() {
      return tail;
    }

    /**
     * @return true if the call has children, i.e. its tail is not Empty
     */
    public boolean hasChildren() {
      return tail.kind() != StmtKind.EMPTY;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), modifiers, name, args, tail);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof TransformChain))
        return false;
      TransformChain other = (TransformChain) obj;
      return modifiers.equals(other.modifiers) && name.equals(other.name) &&
             args.equals(other.args) && tail.equals(other.tail);
    }
  }

  /**
   * { items }
   */
  public static class UnionBlock extends Stmt {
    private final List<Item> items;

    public UnionBlock(List<Item> items, Span span) {
      super(span);
      this.items = ImmutableList.copyOf(items);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.UNION_BLOCK;
    }

    public List<Item> getItems() {
      return items;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), items);
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof UnionBlock &&
             items.equals(((UnionBlock)obj).items);
    }
  }

  /**
   * Shared shape of the constructs written keyword (bindings) body
   */
  public static abstract class BindingBlock extends Stmt {
    private final List<Binding> bindings;
    private final Stmt body;

    protected BindingBlock(List<Binding> bindings, Stmt body, Span span) {
      super(span);
      this.bindings = ImmutableList.copyOf(bindings);
      this.body = body;
    }

    public List<Binding> getBindings() {
      return bindings;
    }

    public Stmt getBody() {
      return body;
    }

    /**
     * @return source keyword introducing the block
     */
    public abstract String keyword();

    @Override
    public int hashCode() {
      return Objects.hash(kind(), bindings, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (obj == null || obj.getClass() != getClass())
        return false;
      BindingBlock other = (BindingBlock) obj;
      return bindings.equals(other.bindings) && body.equals(other.body);
    }
  }

  public static class ForBlock extends BindingBlock {
    public ForBlock(List<Binding> bindings, Stmt body, Span span) {
      super(bindings, body, span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.FOR;
    }

    @Override
    public String keyword() {
      return "for";
    }
  }

  public static class IntersectionForBlock extends BindingBlock {
    public IntersectionForBlock(List<Binding> bindings, Stmt body, Span span) {
      super(bindings, body, span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.INTERSECTION_FOR;
    }

    @Override
    public String keyword() {
      return "intersection_for";
    }
  }

  public static class LetBlock extends BindingBlock {
    public LetBlock(List<Binding> bindings, Stmt body, Span span) {
      super(bindings, body, span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.LET;
    }

    @Override
    public String keyword() {
      return "let";
    }
  }

  /**
   * Deprecated assign (a = 1) body form
   */
  public static class AssignBlock extends BindingBlock {
    public AssignBlock(List<Binding> assignments, Stmt body, Span span) {
      super(assignments, body, span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.ASSIGN;
    }

    @Override
    public String keyword() {
      return "assign";
    }

    public List<Binding> getAssignments() {
      return getBindings();
    }
  }

  public static class IfBlock extends Stmt {
    private final Expr cond;
    private final Stmt thenBranch;
    private final Stmt elseBranch;

    /**
     * @param elseBranch may be null
     */
    public IfBlock(Expr cond, Stmt thenBranch, Stmt elseBranch, Span span) {
      super(span);
      this.cond = cond;
      this.thenBranch = thenBranch;
      this.elseBranch = elseBranch;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.IF;
    }

    public Expr getCond() {
      return cond;
    }

    public Stmt getThenBranch() {
      return thenBranch;
    }

    public Stmt getElseBranch() {
      return elseBranch;
    }

    public boolean hasElse() {
      return elseBranch != null;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), cond, thenBranch, elseBranch);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof IfBlock))
        return false;
      IfBlock other = (IfBlock) obj;
      return cond.equals(other.cond) && thenBranch.equals(other.thenBranch) &&
             Objects.equals(elseBranch, other.elseBranch);
    }
  }

  /**
   * include &lt;path&gt; or use &lt;path&gt;.  The path is kept as written;
   * resolving it is up to the caller.
   */
  public static abstract class FileRef extends Stmt {
    private final String path;

    protected FileRef(String path, Span span) {
      super(span);
      this.path = path;
    }

    public String getPath() {
      return path;
    }

    public abstract String keyword();

    @Override
    public int hashCode() {
      return Objects.hash(kind(), path);
    }

    @Override
    public boolean equals(Object obj) {
      if (obj == null || obj.getClass() != getClass())
        return false;
      return path.equals(((FileRef)obj).path);
    }
  }

  public static class Include extends FileRef {
    public Include(String path, Span span) {
      super(path, span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.INCLUDE;
    }

    @Override
    public String keyword() {
      return "include";
    }
  }

  public static class Use extends FileRef {
    public Use(String path, Span span) {
      super(path, span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.USE;
    }

    @Override
    public String keyword() {
      return "use";
    }
  }

  /**
   * assert(args) body.  The arguments are kept as written; the condition
   * and message are resolved from them by position or name.
   */
  public static class AssertStmt extends Stmt {
    private final List<Arg> args;
    private final Expr cond;
    private final Expr message;
    private final Stmt body;

    /**
     * @param message may be null
     * @param body Empty when the assertion ends with a semicolon
     */
    public AssertStmt(List<Arg> args, Expr cond, Expr message, Stmt body,
                      Span span) {
      super(span);
      this.args = ImmutableList.copyOf(args);
      this.cond = cond;
      this.message = message;
      this.body = body;
    }

    @Override
    public StmtKind kind() {
      return StmtKind.ASSERT;
    }

    public List<Arg> getArgs() {
      return args;
    }

    public Expr getCond() {
      return cond;
    }

    public Expr getMessage() {
      return message;
    }

    public Stmt getBody() {
      return body;
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind(), args, body);
    }

    @Override
    public boolean equals(Object obj) {
      if (!(obj instanceof AssertStmt))
        return false;
      AssertStmt other = (AssertStmt) obj;
      return args.equals(other.args) && body.equals(other.body);
    }
  }

  /**
   * Lone semicolon
   */
  public static class Empty extends Stmt {
    public Empty(Span span) {
      super(span);
    }

    @Override
    public StmtKind kind() {
      return StmtKind.EMPTY;
    }

    @Override
    public int hashCode() {
      return kind().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj instanceof Empty;
    }
  }
}
