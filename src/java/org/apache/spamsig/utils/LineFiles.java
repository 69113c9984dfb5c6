/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.spamsig.utils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.io.MoreFiles;
import org.apache.commons.lang3.StringUtils;

/**
 * Helpers shared by the line oriented accounts and access files.
 */
public final class LineFiles
{
    private LineFiles()
    {
    }

    public static boolean exists(Path file)
    {
        return file != null && Files.isRegularFile(file);
    }

    public static ImmutableList<String> readLines(Path file) throws IOException
    {
        List<String> lines = MoreFiles.asCharSource(file, StandardCharsets.UTF_8).readLines();
        return ImmutableList.copyOf(lines);
    }

    /**
     * Blank lines and whole line comments carry no data. A comment is a line whose
     * first character is '#'.
     */
    public static boolean isIgnorable(String line)
    {
        return StringUtils.isBlank(line) || line.charAt(0) == '#';
    }
}
