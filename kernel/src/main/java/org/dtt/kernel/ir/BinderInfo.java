/*
 * Copyright 2023 VMware, Inc.
 * SPDX-License-Identifier: MIT
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in all
 * copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 * SOFTWARE.
 */

package org.dtt.kernel.ir;

/** How the argument of a binder is supplied at application sites. */
public enum BinderInfo {
    DEFAULT,
    IMPLICIT,
    STRICT_IMPLICIT,
    /** Resolved by typeclass instance search. */
    INST_IMPLICIT;

    public boolean isInstImplicit() {
        return this == INST_IMPLICIT;
    }

    public String open() {
        return switch (this) {
            case DEFAULT -> "(";
            case IMPLICIT -> "{";
            case STRICT_IMPLICIT -> "{{";
            case INST_IMPLICIT -> "[";
        };
    }

    public String close() {
        return switch (this) {
            case DEFAULT -> ")";
            case IMPLICIT -> "}";
            case STRICT_IMPLICIT -> "}}";
            case INST_IMPLICIT -> "]";
        };
    }
}
