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

package org.dtt.kernel.ir.expression;

import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.IDTTNode;
import org.dtt.util.IIndentStream;

/**
 * A binder with a single bound variable.  Chains of binders are represented
 * by nesting.  The body refers to the bound variable with index 0. */
public abstract class DTTBindingExpression extends DTTExpression {
    public final String name;
    public final DTTExpression domain;
    public final BinderInfo binderInfo;
    public final DTTExpression body;

    protected DTTBindingExpression(String name, DTTExpression domain, BinderInfo binderInfo, DTTExpression body) {
        super(Math.max(domain.looseBVarRange, Math.max(body.looseBVarRange - 1, 0)),
                totalWeight(domain, body));
        this.name = name;
        this.domain = domain;
        this.binderInfo = binderInfo;
        this.body = body;
    }

    /** A binder of the same kind, name and binder info with a new domain and body. */
    public abstract DTTBindingExpression rebuild(DTTExpression domain, DTTExpression body);

    protected abstract String binderSymbol();

    @Override
    public boolean sameFields(IDTTNode other) {
        if (other.getClass() != this.getClass())
            return false;
        DTTBindingExpression o = other.to(DTTBindingExpression.class);
        return this.name.equals(o.name) &&
                this.binderInfo == o.binderInfo &&
                this.domain == o.domain &&
                this.body == o.body;
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        DTTBindingExpression o = other.to(DTTBindingExpression.class);
        return this.domain.equals(o.domain) && this.body.equals(o.body);
    }

    @Override
    protected int computeHash() {
        return (this.binderSymbol().hashCode() * 31 + this.domain.hashCode()) * 31 + this.body.hashCode();
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(")
                .append(this.binderSymbol())
                .append(" ")
                .append(this.binderInfo.open())
                .append(this.name)
                .append(" : ")
                .append(this.domain)
                .append(this.binderInfo.close())
                .append(", ")
                .append(this.body)
                .append(")");
    }
}
