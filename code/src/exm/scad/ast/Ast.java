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

import com.google.common.collect.ImmutableList;

import exm.scad.frontend.Context;

/**
 * Root of a converted file: the top-level items, a span covering the whole
 * source and the context built while converting.
 *
 * Equality compares the items only; the context is derived from them.
 */
public class Ast extends Node {
  private final List<Item> items;
  private final Context context;

  public Ast(List<Item> items, Span span, Context context) {
    super(span);
    this.items = ImmutableList.copyOf(items);
    this.context = context;
  }

  public List<Item> getItems() {
    return items;
  }

  public Context getContext() {
    return context;
  }

  @Override
  public int hashCode() {
    return items.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj instanceof Ast && items.equals(((Ast)obj).items);
  }

  @Override
  public String toString() {
    return AstPrinter.print(this);
  }
}
