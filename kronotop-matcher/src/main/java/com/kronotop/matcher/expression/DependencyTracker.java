/*
 * Copyright (c) 2023-2025 Burak Sezer
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.kronotop.matcher.expression;

import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;

/**
 * Collects the field paths a predicate tree reads.
 */
public class DependencyTracker {
    private final Set<String> fields = new TreeSet<>();
    private boolean needWholeDocument;

    public void addField(String path) {
        fields.add(path);
    }

    public Set<String> getFields() {
        return Collections.unmodifiableSet(fields);
    }

    public boolean getNeedWholeDocument() {
        return needWholeDocument;
    }

    public void setNeedWholeDocument(boolean needWholeDocument) {
        this.needWholeDocument = needWholeDocument;
    }

    @Override
    public String toString() {
        return "DependencyTracker {fields=" + fields + ", needWholeDocument=" + needWholeDocument + "}";
    }
}
