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

import org.dtt.kernel.ir.expression.DTTConstantExpression;
import org.dtt.kernel.ir.expression.DTTExpression;
import org.dtt.kernel.ir.expression.DTTLocalExpression;
import org.dtt.kernel.ir.expression.DTTPiExpression;
import org.dtt.kernel.ir.expression.DTTSortExpression;

import javax.annotation.Nullable;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads parameter information from the Pi type of a function head.
 * Only constants and locals have a known type; other heads get no information.
 * Results are cached per head and number of arguments. */
public class FunInfoProvider implements IFunInfoProvider {
    record Key(DTTExpression function, int nargs) {}

    final TypeContext context;
    final Map<Key, FunInfo> cache;

    public FunInfoProvider(TypeContext context) {
        this.context = context;
        this.cache = new HashMap<>();
    }

    @Nullable
    DTTExpression getType(DTTExpression function) {
        DTTConstantExpression constant = function.as(DTTConstantExpression.class);
        if (constant != null) {
            Declaration decl = this.context.getEnvironment().find(constant.name);
            return decl != null ? decl.type() : null;
        }
        DTTLocalExpression local = function.as(DTTLocalExpression.class);
        if (local != null)
            return local.type;
        return null;
    }

    @Override
    public FunInfo getFunInfo(DTTExpression function, int nargs) {
        Key key = new Key(function, nargs);
        FunInfo result = this.cache.get(key);
        if (result != null)
            return result;
        DTTExpression type = this.getType(function);
        if (type == null) {
            result = FunInfo.EMPTY;
        } else {
            List<ParamInfo> params = new ArrayList<>();
            DTTPiExpression pi = type.as(DTTPiExpression.class);
            while (pi != null && params.size() < nargs) {
                boolean isProp = pi.domain.equals(DTTSortExpression.PROP);
                params.add(new ParamInfo(pi.binderInfo, isProp));
                pi = pi.body.as(DTTPiExpression.class);
            }
            result = new FunInfo(params);
        }
        this.cache.put(key, result);
        return result;
    }
}
