/**
 * Typed abstract syntax tree for OpenSCAD source, with a default
 * traversal and a printer that renders trees back to source.
 */
package exm.scad.ast;
