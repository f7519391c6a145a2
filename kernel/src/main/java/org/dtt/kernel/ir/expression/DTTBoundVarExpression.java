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

/** A de Bruijn index: 0 refers to the closest enclosing binder. */
public final class DTTBoundVarExpression extends DTTExpression {
    public final int index;

    public DTTBoundVarExpression(int index) {
        super(index + 1, 1);
        Utilities.enforce(index >= 0, "Negative de Bruijn index " + index);
        this.index = index;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IDTTNode other) {
        DTTBoundVarExpression o = other.as(DTTBoundVarExpression.class);
        if (o == null)
            return false;
        return this.index == o.index;
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        return this.sameFields(other);
    }

    @Override
    protected int computeHash() {
        return 31 * this.index + 7;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        return builder.append("#").append(this.index);
    }

    @SuppressWarnings("unused")
    public static DTTBoundVarExpression fromJson(JsonNode node, JsonDecoder decoder) {
        return new DTTBoundVarExpression(Utilities.getIntProperty(node, "index"));
    }
}
