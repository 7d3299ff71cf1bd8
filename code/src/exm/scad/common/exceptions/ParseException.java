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

package exm.scad.common.exceptions;

import exm.scad.ast.Span;

/**
 * Base of every failure reported by a parse call.  Each one aborts the
 * whole call: no partial tree is returned alongside it.
 *
 * The span refers to the parsed source so that callers can report it
 * directly against the text they passed in.
 * */
public abstract class ParseException
extends Exception
{
  private final Span span;

  protected ParseException(String message, Span span)
  {
    super(span + ": " + message);
    this.span = span;
  }

  public Span getSpan() {
    return span;
  }

  private static final long serialVersionUID = 1L;
}
