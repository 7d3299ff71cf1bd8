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

/**
 * Rules enforced by strict validation
 */
public enum SemanticErrorKind {
  /** let/for/assign construct with no bindings */
  EMPTY_BINDING,
  /** multmatrix argument that is not 3 or 4 rows of 4 columns */
  INVALID_MATRIX_SHAPE,
  /** the same named argument given twice in one call */
  DUPLICATE_NAMED_ARG;
}
