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

import com.fasterxml.jackson.databind.JsonNode;
import org.dtt.kernel.backend.JsonDecoder;
import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.visitors.InnerVisitor;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.Utilities;

/** A dependent function type. */
public final class DTTPiExpression extends DTTBindingExpression {
    public DTTPiExpression(String name, DTTExpression domain, BinderInfo binderInfo, DTTExpression body) {
        super(name, domain, binderInfo, body);
    }

    public DTTPiExpression(String name, DTTExpression domain, DTTExpression body) {
        this(name, domain, BinderInfo.DEFAULT, body);
    }

    @Override
    public DTTPiExpression rebuild(DTTExpression domain, DTTExpression body) {
        if (domain == this.domain && body == this.body)
            return this;
        return new DTTPiExpression(this.name, domain, this.binderInfo, body);
    }

    @Override
    protected String binderSymbol() {
        return "Pi";
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("domain");
        this.domain.accept(visitor);
        visitor.property("body");
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @SuppressWarnings("unused")
    public static DTTPiExpression fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        DTTExpression domain = fromJsonInner(node, "domain", decoder, DTTExpression.class);
        BinderInfo info = BinderInfo.valueOf(Utilities.getStringProperty(node, "binderInfo"));
        DTTExpression body = fromJsonInner(node, "body", decoder, DTTExpression.class);
        return new DTTPiExpression(name, domain, info, body);
    }
}
