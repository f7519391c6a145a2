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

import org.dtt.kernel.errors.KernelError;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.visitors.CollectMetas;
import org.dtt.util.IWritesLogs;
import org.dtt.util.Logger;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A collection of rewrite rules indexed by the head symbol of their left-hand side.
 * For each head the lemmas are kept sorted by decreasing priority;
 * among lemmas with the same priority the most recently inserted comes first. */
public class SimpLemmas implements IWritesLogs {
    final Map<HeadIndex, List<SimpLemma>> index;

    public SimpLemmas() {
        this.index = new HashMap<>();
    }

    static Set<String> metas(DTTExpression expression) {
        CollectMetas collect = new CollectMetas();
        collect.apply(expression);
        return collect.metas;
    }

    public SimpLemmas insert(SimpLemma lemma) {
        HeadIndex head = lemma.getHead();
        if (head.kind() == HeadIndex.Kind.META || head.kind() == HeadIndex.Kind.BOUND_VAR)
            throw new KernelError("Invalid lemma " + lemma.name + ": left-hand side head is " + head);
        if (lemma.lhs.hasLooseBVars() || lemma.rhs.hasLooseBVars())
            throw new KernelError("Invalid lemma " + lemma.name + ": loose bound variables");
        Set<String> lhsMetas = metas(lemma.lhs);
        for (String meta: metas(lemma.rhs)) {
            if (!lhsMetas.contains(meta))
                throw new KernelError("Invalid lemma " + lemma.name + ": metavariable ?" + meta +
                        " of the right-hand side does not occur on the left-hand side");
        }

        List<SimpLemma> lemmas = this.index.computeIfAbsent(head, k -> new ArrayList<>());
        int position = 0;
        while (position < lemmas.size() && lemmas.get(position).priority > lemma.priority)
            position++;
        lemmas.add(position, lemma);
        Logger.INSTANCE.belowLevel(this, 1)
                .append("Inserted ")
                .append(lemma.toString())
                .newline();
        return this;
    }

    public SimpLemmas insert(String name, DTTExpression lhs, DTTExpression rhs) {
        return this.insert(new SimpLemma(name, lhs, rhs));
    }

    /** Remove all lemmas with the given name.
     * @return True if any lemma was removed. */
    public boolean erase(String name) {
        boolean found = false;
        for (List<SimpLemma> lemmas: this.index.values())
            found |= lemmas.removeIf(l -> l.name.equals(name));
        this.index.values().removeIf(List::isEmpty);
        return found;
    }

    /** The lemmas which may apply to 'expression', in the order they should be tried,
     * or null if there are none. */
    @Nullable
    public List<SimpLemma> find(DTTExpression expression) {
        if (expression.hasLooseBVars())
            return null;
        HeadIndex head = HeadIndex.of(expression);
        if (head.kind() == HeadIndex.Kind.BOUND_VAR)
            return null;
        List<SimpLemma> lemmas = this.index.get(head);
        if (lemmas == null)
            return null;
        return Collections.unmodifiableList(lemmas);
    }

    public int size() {
        int result = 0;
        for (List<SimpLemma> lemmas: this.index.values())
            result += lemmas.size();
        return result;
    }
}
