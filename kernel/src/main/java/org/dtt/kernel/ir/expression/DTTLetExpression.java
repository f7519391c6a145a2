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
import org.dtt.kernel.ir.IDTTNode;
import org.dtt.kernel.visitors.InnerVisitor;
import org.dtt.kernel.visitors.VisitDecision;
import org.dtt.util.IIndentStream;
import org.dtt.util.Utilities;

/** let name : type := value in body.
 * The body refers to the bound variable with index 0. */
public final class DTTLetExpression extends DTTExpression {
    public final String name;
    public final DTTExpression type;
    public final DTTExpression value;
    public final DTTExpression body;

    public DTTLetExpression(String name, DTTExpression type, DTTExpression value, DTTExpression body) {
        super(Math.max(maxRange(type, value), Math.max(body.looseBVarRange - 1, 0)),
                totalWeight(type, value, body));
        this.name = name;
        this.type = type;
        this.value = value;
        this.body = body;
    }

    public DTTLetExpression rebuild(DTTExpression type, DTTExpression value, DTTExpression body) {
        if (type == this.type && value == this.value && body == this.body)
            return this;
        return new DTTLetExpression(this.name, type, value, body);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.property("value");
        this.value.accept(visitor);
        visitor.property("body");
        this.body.accept(visitor);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IDTTNode other) {
        DTTLetExpression o = other.as(DTTLetExpression.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.value == o.value &&
                this.body == o.body;
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        DTTLetExpression o = other.to(DTTLetExpression.class);
        return this.type.equals(o.type) && this.value.equals(o.value) && this.body.equals(o.body);
    }

    @Override
    protected int computeHash() {
        return ((this.type.hashCode() * 31 + this.value.hashCode()) * 31 + this.body.hashCode()) * 31 + 3;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("(let ")
                .append(this.name)
                .append(" : ")
                .append(this.type)
                .append(" := ")
                .append(this.value)
                .append(" in ")
                .append(this.body)
                .append(")");
    }

    @SuppressWarnings("unused")
    public static DTTLetExpression fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        DTTExpression type = fromJsonInner(node, "type", decoder, DTTExpression.class);
        DTTExpression value = fromJsonInner(node, "value", decoder, DTTExpression.class);
        DTTExpression body = fromJsonInner(node, "body", decoder, DTTExpression.class);
        return new DTTLetExpression(name, type, value, body);
    }
}
