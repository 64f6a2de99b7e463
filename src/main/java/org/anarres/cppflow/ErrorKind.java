/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppflow;

/**
 * The kinds of {@link FlowException}.
 */
public enum ErrorKind {

    /** An elsif, else or endif without an open block. */
    UNMATCHED_DIRECTIVE,
    /** End of input reached inside a block. */
    UNCOMPLETED_CONDITIONAL,
    /** An ifdef, ifndef or elsif not followed by a macro name. */
    MALFORMED_OPERAND,
    /** More distinct macros than the registry capacity. */
    MACRO_CAPACITY_EXCEEDED,
    /** An else or elsif after the else of the same block. */
    CLAUSE_AFTER_ELSE;
}
