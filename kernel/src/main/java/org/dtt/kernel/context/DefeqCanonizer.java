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

package org.dtt.kernel.context;

import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.simp.HeadIndex;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Keeps one representative per definitional equality class, bucketed by the head
 * symbol of the fully reduced expression.
 * The representative is the expression with the smallest weight seen so far.
 * When a lighter expression replaces a representative the result is flagged as mutated. */
public class DefeqCanonizer implements IDefeqCanonizer, IWritesLogs {
    final TypeContext context;
    final Map<HeadIndex, List<DTTExpression>> representatives;

    public DefeqCanonizer(TypeContext context) {
        this.context = context;
        this.representatives = new HashMap<>();
    }

    @Override
    public CanonizeResult canonize(DTTExpression expression) {
        DTTExpression reduced = expression.hasLooseBVars() ? expression : this.context.normalize(expression);
        HeadIndex head = HeadIndex.of(reduced);
        List<DTTExpression> bucket = this.representatives.computeIfAbsent(head, k -> new ArrayList<>());
        for (int i = 0; i < bucket.size(); i++) {
            DTTExpression candidate = bucket.get(i);
            if (!this.context.isDefEq(candidate, expression))
                continue;
            if (expression.weight < candidate.weight) {
                Logger.INSTANCE.belowLevel(this, 1)
                        .append("Replacing representative ")
                        .append(candidate)
                        .append(" with ")
                        .append(expression)
                        .newline();
                bucket.set(i, expression);
                return new CanonizeResult(expression, true);
            }
            return new CanonizeResult(candidate, false);
        }
        bucket.add(expression);
        return new CanonizeResult(expression, false);
    }

    /** Number of representatives currently known. */
    public int size() {
        int result = 0;
        for (List<DTTExpression> bucket: this.representatives.values())
            result += bucket.size();
        return result;
    }
}
