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

import org.dtt.kernel.errors.KernelError;
import org.dtt.kernel.ir.expression.DTTExpression;

import javax.annotation.Nullable;
import java.util.LinkedHashMap;
import java.util.Map;

/** The global declarations visible to the kernel. */
public class Environment {
    final Map<String, Declaration> declarations;

    public Environment() {
        this.declarations = new LinkedHashMap<>();
    }

    public Declaration add(Declaration declaration) {
        if (declaration.type().hasLooseBVars())
            throw new KernelError("Type of " + declaration.name() + " has loose bound variables");
        if (declaration.value() != null && declaration.value().hasLooseBVars())
            throw new KernelError("Value of " + declaration.name() + " has loose bound variables");
        if (this.declarations.containsKey(declaration.name()))
            throw new KernelError("Duplicate declaration " + declaration.name());
        this.declarations.put(declaration.name(), declaration);
        return declaration;
    }

    public Declaration addAxiom(String name, DTTExpression type) {
        return this.add(new Declaration(name, type, null));
    }

    public Declaration addDefinition(String name, DTTExpression type, DTTExpression value) {
        return this.add(new Declaration(name, type, value));
    }

    @Nullable
    public Declaration find(String name) {
        return this.declarations.get(name);
    }

    public Declaration get(String name) {
        Declaration result = this.find(name);
        if (result == null)
            throw new KernelError("Unknown declaration " + name);
        return result;
    }

    public int size() {
        return this.declarations.size();
    }
}
