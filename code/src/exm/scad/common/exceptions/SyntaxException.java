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
 * The source could not be parsed: the concrete tree holds an error or
 * missing node, or a construct has a shape the language does not allow.
 */
public class SyntaxException extends ParseException {

  private final String detail;

  public SyntaxException(String message, Span span) {
    super(message, span);
    this.detail = message;
  }

  /**
   * @return the message without the location prefix
   */
  public String getDetail() {
    return detail;
  }

  private static final long serialVersionUID = 1L;
}
