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

import org.dtt.kernel.ir.expression.DTTAppExpression;
import org.dtt.kernel.ir.expression.DTTBindingExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTMacroExpression;
import org.dtt.kernel.ir.expression.DTTMetaExpression;

import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.Map;

/**
 * First-order matching of a pattern against an expression.
 * Metavariables in the pattern match closed subterms; a metavariable which
 * occurs several times must match equal subterms.  Everything else must
 * match structurally. */
public class PatternMatcher {
    final Map<String, DTTExpression> assignment;

    public PatternMatcher() {
        this.assignment = new HashMap<>();
    }

    /** Match 'pattern' against 'expression'.
     * @return The assignment of the pattern's metavariables, or null if there is no match. */
    @Nullable
    public static Map<String, DTTExpression> match(DTTExpression pattern, DTTExpression expression) {
        PatternMatcher matcher = new PatternMatcher();
        if (matcher.matches(pattern, expression))
            return matcher.assignment;
        return null;
    }

    boolean matches(DTTExpression[] patterns, DTTExpression[] expressions) {
        if (patterns.length != expressions.length)
            return false;
        for (int i = 0; i < patterns.length; i++)
            if (!this.matches(patterns[i], expressions[i]))
                return false;
        return true;
    }

    boolean matches(DTTExpression pattern, DTTExpression expression) {
        DTTMetaExpression meta = pattern.as(DTTMetaExpression.class);
        if (meta != null) {
            if (expression.hasLooseBVars())
                return false;
            DTTExpression previous = this.assignment.get(meta.name);
            if (previous != null)
                return previous.equals(expression);
            this.assignment.put(meta.name, expression);
            return true;
        }
        if (pattern.getClass() != expression.getClass())
            return false;

        DTTAppExpression app = pattern.as(DTTAppExpression.class);
        if (app != null) {
            DTTAppExpression other = expression.to(DTTAppExpression.class);
            return this.matches(app.function, other.function) &&
                    this.matches(app.arguments, other.arguments);
        }
        DTTBindingExpression binding = pattern.as(DTTBindingExpression.class);
        if (binding != null) {
            DTTBindingExpression other = expression.to(DTTBindingExpression.class);
            return this.matches(binding.domain, other.domain) &&
                    this.matches(binding.body, other.body);
        }
        DTTLetExpression let = pattern.as(DTTLetExpression.class);
        if (let != null) {
            DTTLetExpression other = expression.to(DTTLetExpression.class);
            return this.matches(let.type, other.type) &&
                    this.matches(let.value, other.value) &&
                    this.matches(let.body, other.body);
        }
        DTTMacroExpression macro = pattern.as(DTTMacroExpression.class);
        if (macro != null) {
            DTTMacroExpression other = expression.to(DTTMacroExpression.class);
            return macro.definition.equals(other.definition) &&
                    this.matches(macro.arguments, other.arguments);
        }
        // Leaves
        return pattern.equals(expression);
    }
}
