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
import org.dtt.util.Linq;
import org.dtt.util.Utilities;

import java.util.Arrays;
import java.util.List;

/** Function application.  The function is never itself an application;
 * use {@link DTTExpression#call} to build applications of applications. */
public final class DTTAppExpression extends DTTExpression {
    public final DTTExpression function;
    public final DTTExpression[] arguments;

    public DTTAppExpression(DTTExpression function, DTTExpression... arguments) {
        super(Math.max(function.looseBVarRange, maxRange(arguments)),
                function.weight + totalWeight(arguments));
        Utilities.enforce(!function.is(DTTAppExpression.class), "Application head is an application " + function);
        Utilities.enforce(arguments.length > 0, "Application without arguments " + function);
        this.function = function;
        this.arguments = arguments;
    }

    /** The same function applied to new arguments, or this if the arguments
     * are the same objects. */
    public DTTAppExpression replaceArguments(DTTExpression... arguments) {
        if (Linq.same(this.arguments, arguments))
            return this;
        return new DTTAppExpression(this.function, arguments);
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("function");
        this.function.accept(visitor);
        visitor.startArrayProperty("arguments");
        for (DTTExpression arg : this.arguments)
            arg.accept(visitor);
        visitor.endArrayProperty("arguments");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IDTTNode other) {
        DTTAppExpression o = other.as(DTTAppExpression.class);
        if (o == null)
            return false;
        return this.function == o.function &&
                Linq.same(this.arguments, o.arguments);
    }

    @Override
    protected boolean sameStructure(DTTExpression other) {
        DTTAppExpression o = other.to(DTTAppExpression.class);
        return this.function.equals(o.function) && allEqual(this.arguments, o.arguments);
    }

    @Override
    protected int computeHash() {
        return this.function.hashCode() * 31 + Arrays.hashCode(this.arguments);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("(").append(this.function);
        for (DTTExpression arg: this.arguments)
            builder.append(" ").append(arg);
        return builder.append(")");
    }

    @SuppressWarnings("unused")
    public static DTTAppExpression fromJson(JsonNode node, JsonDecoder decoder) {
        DTTExpression function = fromJsonInner(node, "function", decoder, DTTExpression.class);
        List<DTTExpression> arguments = fromJsonInnerList(node, "arguments", decoder, DTTExpression.class);
        return new DTTAppExpression(function, arguments.toArray(new DTTExpression[0]));
    }
}
