/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppflow;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.annotation.Nonnull;

import org.apache.commons.io.FileUtils;

/**
 * A {@link Source} which lexes a file.
 *
 * The file is read fully as UTF-8 when the source is created.
 */
public class FileLexerSource extends LexerSource {

    private final String path;

    public FileLexerSource(@Nonnull File file)
            throws IOException {
        super(FileUtils.readFileToString(file, StandardCharsets.UTF_8));
        this.path = file.getPath();
    }

    @Override
    public String getPath() {
        return path;
    }

    @Override
    public String getName() {
        return getPath();
    }

    @Override
    public String toString() {
        return "file " + getPath();
    }
}
