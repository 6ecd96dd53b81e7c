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

package com.kronotop.matcher.values;

import com.ibm.icu.text.Collator;
import com.ibm.icu.util.ULocale;

import javax.annotation.Nonnull;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link Collation} backed by an ICU4J {@link Collator}. Instances are frozen and shared per locale and strength.
 */
public final class IcuCollation implements Collation {
    private static final String ROOT_LOCALE = "";
    private static final Map<CollationKey, IcuCollation> REGISTRY = new ConcurrentHashMap<>();

    private final Collator collator;
    private final String spec;

    private IcuCollation(Collator collator, String spec) {
        this.collator = collator;
        this.spec = spec;
    }

    public static IcuCollation of(@Nonnull String locale) {
        return of(locale, Collator.TERTIARY);
    }

    /**
     * @param locale   an ICU locale id such as {@code "fr_CA"}, or an empty string for the root locale
     * @param strength one of the {@link Collator} strength constants
     */
    public static IcuCollation of(@Nonnull String locale, int strength) {
        return REGISTRY.computeIfAbsent(new CollationKey(locale, strength), key -> {
            Collator collator = ROOT_LOCALE.equals(locale)
                    ? Collator.getInstance(ULocale.forLocale(Locale.ROOT))
                    : Collator.getInstance(new ULocale(locale));
            collator.setStrength(strength);
            return new IcuCollation(collator.freeze(), locale + "/" + strength);
        });
    }

    @Override
    public int compare(String left, String right) {
        return collator.compare(left, right);
    }

    @Override
    public String getSpec() {
        return spec;
    }

    @Override
    public String toString() {
        return "IcuCollation {" + spec + "}";
    }

    private record CollationKey(String locale, int strength) {
    }
}
