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

package com.kronotop.matcher.expression.aggregation;

import com.kronotop.matcher.expression.DependencyTracker;
import com.kronotop.matcher.expression.PathUtils;
import org.bson.BsonString;
import org.bson.BsonValue;

import java.util.Map;
import java.util.Objects;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A field reference such as {@code "$a.b"}, or one of the {@code $$ROOT} and {@code $$CURRENT} variables.
 */
public final class FieldPathExpression implements AggregationExpression {
    public static final String ROOT = "$$ROOT";
    public static final String CURRENT = "$$CURRENT";

    private String path;
    private final boolean wholeDocument;

    private FieldPathExpression(String path, boolean wholeDocument) {
        this.path = path;
        this.wholeDocument = wholeDocument;
    }

    /**
     * Parses a {@code $}-prefixed field reference.
     */
    public static FieldPathExpression parse(String raw) {
        Objects.requireNonNull(raw, "raw must not be null");
        if (raw.equals(ROOT) || raw.equals(CURRENT)) {
            return new FieldPathExpression("", true);
        }
        checkArgument(raw.length() > 1 && raw.charAt(0) == '$' && raw.charAt(1) != '$',
                "not a field path: %s", raw);
        return new FieldPathExpression(raw.substring(1), false);
    }

    public String getPath() {
        return path;
    }

    public boolean isWholeDocument() {
        return wholeDocument;
    }

    @Override
    public void addDependencies(DependencyTracker deps) {
        if (wholeDocument) {
            deps.setNeedWholeDocument(true);
        } else {
            deps.addField(path);
        }
    }

    @Override
    public void applyRename(Map<String, String> renames) {
        if (wholeDocument) {
            return;
        }
        String rewritten = PathUtils.renamePath(path, renames);
        if (rewritten != null) {
            path = rewritten;
        }
    }

    @Override
    public boolean equivalent(AggregationExpression other) {
        return other instanceof FieldPathExpression fieldPath
                && wholeDocument == fieldPath.wholeDocument
                && path.equals(fieldPath.path);
    }

    @Override
    public BsonValue serialize() {
        return new BsonString(wholeDocument ? ROOT : "$" + path);
    }
}
