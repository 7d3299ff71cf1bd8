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
 * Raised only in strict mode, for source that parses but breaks one of
 * the rules in {@link SemanticErrorKind}.
 */
public class SemanticException extends ParseException {

  private final SemanticErrorKind kind;
  private final String details;

  public SemanticException(SemanticErrorKind kind, Span span, String details) {
    super(kind + ": " + details, span);
    this.kind = kind;
    this.details = details;
  }

  public SemanticErrorKind getKind() {
    return kind;
  }

  public String getDetails() {
    return details;
  }

  private static final long serialVersionUID = 1L;
}
