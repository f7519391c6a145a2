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

import org.dtt.kernel.ir.BinderInfo;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLambdaExpression;
import org.dtt.kernel.ir.expression.DTTLetExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.dtt.util.Utilities;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A frame of fresh locals pushed on a {@link TypeContext}.
 * Closing the frame pops all its locals.  Use with try-with-resources. */
public class TmpLocals implements AutoCloseable {
    final TypeContext context;
    final List<DTTLocalExpression> locals;
    /** Let values, parallel to 'locals'; null for ordinary locals. */
    final List<DTTExpression> values;
    boolean closed;

    TmpLocals(TypeContext context) {
        this.context = context;
        this.locals = new ArrayList<>();
        this.values = new ArrayList<>();
        this.closed = false;
    }

    public DTTLocalExpression pushLocal(String name, DTTExpression type, BinderInfo binderInfo) {
        Utilities.enforce(!this.closed, "Frame already closed");
        DTTLocalExpression local = this.context.pushLocal(name, type, binderInfo);
        this.locals.add(local);
        this.values.add(null);
        return local;
    }

    public DTTLocalExpression pushLet(String name, DTTExpression type, DTTExpression value) {
        Utilities.enforce(!this.closed, "Frame already closed");
        DTTLocalExpression local = this.context.pushLet(name, type, value);
        this.locals.add(local);
        this.values.add(value);
        return local;
    }

    public int size() {
        return this.locals.size();
    }

    public List<DTTLocalExpression> asList() {
        return Collections.unmodifiableList(this.locals);
    }

    List<DTTLocalExpression> prefix(int count) {
        return this.locals.subList(0, count);
    }

    /** Abstract the frame's locals out of 'body', producing nested lambdas. */
    public DTTExpression mkLambda(DTTExpression body) {
        DTTExpression result = this.context.abstractLocals(body, this.locals);
        for (int i = this.locals.size() - 1; i >= 0; i--) {
            DTTLocalExpression local = this.locals.get(i);
            DTTExpression domain = this.context.abstractLocals(local.type, this.prefix(i));
            result = new DTTLambdaExpression(local.prettyName, domain, local.binderInfo, result);
        }
        return result;
    }

    /** Abstract the frame's locals out of 'body', producing nested Pi types. */
    public DTTExpression mkPi(DTTExpression body) {
        DTTExpression result = this.context.abstractLocals(body, this.locals);
        for (int i = this.locals.size() - 1; i >= 0; i--) {
            DTTLocalExpression local = this.locals.get(i);
            DTTExpression domain = this.context.abstractLocals(local.type, this.prefix(i));
            result = new DTTPiExpression(local.prettyName, domain, local.binderInfo, result);
        }
        return result;
    }

    /** Abstract the frame's let-locals out of 'body', producing nested lets. */
    public DTTExpression mkLet(DTTExpression body) {
        DTTExpression result = this.context.abstractLocals(body, this.locals);
        for (int i = this.locals.size() - 1; i >= 0; i--) {
            DTTLocalExpression local = this.locals.get(i);
            @Nullable DTTExpression value = this.values.get(i);
            Utilities.enforce(value != null, "Local " + local.prettyName + " is not a let");
            List<DTTLocalExpression> outer = this.prefix(i);
            result = new DTTLetExpression(local.prettyName,
                    this.context.abstractLocals(local.type, outer),
                    this.context.abstractLocals(value, outer),
                    result);
        }
        return result;
    }

    @Override
    public void close() {
        if (this.closed)
            return;
        this.closed = true;
        for (int i = this.locals.size() - 1; i >= 0; i--)
            this.context.popLocal(this.locals.get(i));
    }
}
