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

package org.dtt.kernel.simp;

import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.visitors.InstantiateMetas;

import javax.annotation.Nullable;
import java.util.Map;

/**
 * A rewrite rule lhs = rhs.  Metavariables of the left-hand side are pattern variables.
 * A 'refl' lemma holds by reflexivity and can be applied unconditionally;
 * other lemmas have hypotheses which need proof search. */
public class SimpLemma {
    public final String name;
    public final DTTExpression lhs;
    public final DTTExpression rhs;
    public final int priority;
    public final boolean refl;

    public static final int DEFAULT_PRIORITY = 1000;

    public SimpLemma(String name, DTTExpression lhs, DTTExpression rhs, int priority, boolean refl) {
        this.name = name;
        this.lhs = lhs;
        this.rhs = rhs;
        this.priority = priority;
        this.refl = refl;
    }

    /** An unconditional lemma with default priority. */
    public SimpLemma(String name, DTTExpression lhs, DTTExpression rhs) {
        this(name, lhs, rhs, DEFAULT_PRIORITY, true);
    }

    public HeadIndex getHead() {
        return HeadIndex.of(this.lhs);
    }

    /** If the left-hand side matches 'expression' return the instantiated right-hand side,
     * otherwise null. */
    @Nullable
    public DTTExpression rewrite(DTTExpression expression) {
        Map<String, DTTExpression> assignment = PatternMatcher.match(this.lhs, expression);
        if (assignment == null)
            return null;
        return new InstantiateMetas(assignment).apply(this.rhs);
    }

    @Override
    public String toString() {
        return this.name + " : " + this.lhs + " = " + this.rhs +
                (this.refl ? "" : " (conditional)") + " @" + this.priority;
    }
}
