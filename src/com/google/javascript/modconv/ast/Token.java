/*
 *
 * ***** BEGIN LICENSE BLOCK *****
 * Version: MPL 1.1/GPL 2.0
 *
 * The contents of this file are subject to the Mozilla Public License Version
 * 1.1 (the "License"); you may not use this file except in compliance with
 * the License. You may obtain a copy of the License at
 * http://www.mozilla.org/MPL/
 *
 * Software distributed under the License is distributed on an "AS IS" basis,
 * WITHOUT WARRANTY OF ANY KIND, either express or implied. See the License
 * for the specific language governing rights and limitations under the
 * License.
 *
 * The Original Code is Rhino code, released
 * May 6, 1999.
 *
 * The Initial Developer of the Original Code is
 * Netscape Communications Corporation.
 * Portions created by the Initial Developer are Copyright (C) 1997-1999
 * the Initial Developer. All Rights Reserved.
 *
 * Contributor(s):
 *   Roger Lawrence
 *   Mike McCabe
 *   Igor Bukanov
 *   Milen Nankov
 *
 * Alternatively, the contents of this file may be used under the terms of
 * the GNU General Public License Version 2 or later (the "GPL"), in which
 * case the provisions of the GPL are applicable instead of those above. If
 * you wish to allow use of your version of this file only under the terms of
 * the GPL and not to allow others to use your version of this file under the
 * MPL, indicate your decision by deleting the provisions above and replacing
 * them with the notice and other provisions required by the GPL. If you do
 * not delete the provisions above, a recipient may use your version of this
 * file under either the MPL or the GPL.
 *
 * ***** END LICENSE BLOCK ***** */

package com.google.javascript.modconv.ast;

/**
 * The statement and expression kinds the module converter reads and writes.
 *
 * <p>This is the subset of the Rhino token set that CommonJS module emit produces at the top level
 * of a file, plus {@link #NOT_EMITTED}.
 */
public enum Token {
  RETURN,
  NOT,
  TYPEOF,
  VOID, // void keyword
  NEW,
  GETPROP,
  GETELEM,
  CALL,

  NAME,
  NUMBER,
  STRINGLIT,
  NULL,
  THIS,
  FALSE,
  TRUE,
  ARRAYLIT, // array literal
  OBJECTLIT, // object literal

  PARAM_LIST,
  COMMA, // comma operator
  ASSIGN, // simple assignment  (=)
  OR, // logical or (||)
  AND, // logical and (&&)

  FUNCTION, // function keyword
  VAR, // var keyword
  LET, // block scoped vars
  CONST, // JS 1.5 const keyword
  EMPTY,
  BLOCK, // statement block
  EXPR_RESULT, // expression statement in scripts
  SCRIPT, // top-level node for entire script

  STRING_KEY, // object literal key
  MEMBER_FUNCTION_DEF,
  CLASS, // classes
  CLASS_MEMBERS, // class member container

  ITER_REST, // Rests that use the iterator protocol.
  DEFAULT_VALUE, // Formal parameter or destructuring element with a default value
  ARRAY_PATTERN, // destructuring patterns
  OBJECT_PATTERN,

  IMPORT, // modules
  EXPORT,

  // A statement that produces no code. It keeps the comments of a statement that was removed.
  NOT_EMITTED;
}
