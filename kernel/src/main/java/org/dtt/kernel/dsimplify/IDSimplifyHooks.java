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

package org.dtt.kernel.dsimplify;

import org.dtt.kernel.ir.expression.DTTExpression;

import javax.annotation.Nullable;

/**
 * The rewriting strategy used by a {@link DSimplifyVisitor}.
 * A null result means 'no change'. */
public interface IDSimplifyHooks {
    /** Called before the children of 'expression' are simplified. */
    @Nullable
    default HookResult pre(DTTExpression expression, DSimplifyVisitor engine) {
        return null;
    }

    /** Called after the children of 'expression' have been simplified. */
    @Nullable
    default HookResult post(DTTExpression expression, DSimplifyVisitor engine) {
        return null;
    }

    /** Hooks which never change anything. */
    IDSimplifyHooks NONE = new IDSimplifyHooks() {};
}
