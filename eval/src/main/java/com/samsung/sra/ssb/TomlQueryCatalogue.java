/*
* Copyright 2016 Samsung Research America. All rights reserved.
*
* Licensed under the Apache License, Version 2.0 (the "License");
* you may not use this file except in compliance with the License.
* You may obtain a copy of the License at
*
*     http://www.apache.org/licenses/LICENSE-2.0
*
* Unless required by applicable law or agreed to in writing, software
* distributed under the License is distributed on an "AS IS" BASIS,
* WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
* See the License for the specific language governing permissions and
* limitations under the License.
*/
package com.samsung.sra.ssb;

import com.moandjiezana.toml.Toml;
import com.samsung.sra.querybench.QuerySet;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Query catalogue read from a Toml file holding one {@code [[query]]} table per query set:
 * <pre>
 * [[query]]
 * name = "3.4"
 * template = '''Sum(Intersect(Bitmap(frame="c_city", rowID=%d), Bitmap(frame="s_city", rowID=%d)), ...)'''
 * args = ["181,185", "181,185"]
 * </pre>
 * with optional {@code setup} and {@code teardown} statements. Every entry is validated when the catalogue is
 * loaded.
 */
public class TomlQueryCatalogue implements QueryCatalogue {
    private static final Logger logger = LoggerFactory.getLogger(TomlQueryCatalogue.class);

    /** Classpath location of the Star Schema Benchmark catalogue */
    public static final String BUNDLED_RESOURCE = "/ssb-queries.toml";

    private final Map<String, QuerySet> querySets = new LinkedHashMap<>();

    public TomlQueryCatalogue(Toml toml) {
        List<Toml> entries = toml.getTables("query");
        if (entries == null) {
            return;
        }
        for (Toml entry : entries) {
            QuerySet querySet = parse(entry);
            if (querySets.put(querySet.getName(), querySet) != null) {
                throw new IllegalArgumentException("duplicate query set " + querySet.getName());
            }
        }
    }

    public static TomlQueryCatalogue fromFile(File file) {
        if (!file.isFile()) throw new IllegalArgumentException("invalid or non-existent catalogue file " + file);
        return new TomlQueryCatalogue(new Toml().read(file));
    }

    public static TomlQueryCatalogue bundled() {
        try (InputStream in = TomlQueryCatalogue.class.getResourceAsStream(BUNDLED_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("missing resource " + BUNDLED_RESOURCE);
            }
            return new TomlQueryCatalogue(new Toml().read(in));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static QuerySet parse(Toml entry) {
        String name = entry.getString("name");
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("query set without a name");
        }
        String template = StringUtils.strip(entry.getString("template"));
        if (StringUtils.isEmpty(template)) {
            throw new IllegalArgumentException("query set " + name + " has no template");
        }
        List<String> args = entry.getList("args", Collections.emptyList());
        try {
            return new QuerySet(name, template,
                    StringUtils.strip(entry.getString("setup")), StringUtils.strip(entry.getString("teardown")),
                    ArgumentSets.parseAll(args));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("query set " + name + ": " + e.getMessage(), e);
        }
    }

    @Override
    public QuerySet get(String name) {
        QuerySet querySet = querySets.get(name);
        if (querySet == null) {
            logger.warn("unknown query set {}, running nothing", name);
            return QuerySet.empty(name);
        }
        return querySet;
    }

    @Override
    public Set<String> getNames() {
        return Collections.unmodifiableSet(querySets.keySet());
    }
}
