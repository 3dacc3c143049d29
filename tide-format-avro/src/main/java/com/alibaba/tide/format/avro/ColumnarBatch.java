/*
 * Copyright (c) 2024 Alibaba Group Holding Ltd.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.alibaba.tide.format.avro;

import com.alibaba.tide.annotation.PublicEvolving;

import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VectorSchemaRoot;
import org.apache.arrow.vector.dictionary.Dictionary;
import org.apache.arrow.vector.dictionary.DictionaryProvider;
import org.apache.arrow.vector.types.pojo.Schema;

import static com.alibaba.tide.utils.Preconditions.checkNotNull;

/**
 * A batch of decoded rows: one Arrow vector per column of the target schema, plus the
 * dictionaries of its dictionary-encoded columns.
 *
 * <p>The batch owns its vectors and dictionaries. Closing it releases their memory.
 *
 * @since 0.1
 */
@PublicEvolving
public class ColumnarBatch implements AutoCloseable {

    private final VectorSchemaRoot root;
    private final DictionaryProvider.MapDictionaryProvider dictionaries;

    public ColumnarBatch(
            VectorSchemaRoot root, DictionaryProvider.MapDictionaryProvider dictionaries) {
        this.root = checkNotNull(root);
        this.dictionaries = checkNotNull(dictionaries);
    }

    public int getRowCount() {
        return root.getRowCount();
    }

    /** Returns the schema of the batch, in which dictionary-encoded fields have index types. */
    public Schema getSchema() {
        return root.getSchema();
    }

    public VectorSchemaRoot getRoot() {
        return root;
    }

    public FieldVector getVector(String name) {
        return checkNotNull(root.getVector(name), "Column '%s' does not exist.", name);
    }

    public DictionaryProvider getDictionaryProvider() {
        return dictionaries;
    }

    /** Returns the dictionary with the given id. */
    public Dictionary getDictionary(long id) {
        return checkNotNull(dictionaries.lookup(id), "Dictionary %s does not exist.", id);
    }

    @Override
    public void close() {
        root.close();
        closeDictionaries(dictionaries);
    }

    static void closeDictionaries(DictionaryProvider.MapDictionaryProvider dictionaries) {
        for (long id : dictionaries.getDictionaryIds()) {
            dictionaries.lookup(id).getVector().close();
        }
    }
}
