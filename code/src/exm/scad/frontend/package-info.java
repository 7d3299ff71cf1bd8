/**
 * The frontend package turns the concrete parse tree into the AST,
 * building the scope and definition context as it goes, and holds the
 * checks that run over the finished tree.
 */
package exm.scad.frontend;
