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
package org.apache.spamsig.config;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.MalformedURLException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import com.google.common.io.Resources;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import org.apache.spamsig.exceptions.ConfigurationException;

/**
 * Reads the configuration from YAML. The location is taken from the system
 * property {@value #CONFIG_PROPERTY}, which may be a URL, a file path or the name
 * of a classpath resource, and defaults to {@value #DEFAULT_CONFIGURATION} on the
 * classpath.
 */
public class YamlConfigurationLoader implements ConfigurationLoader
{
    private static final Logger logger = LoggerFactory.getLogger(YamlConfigurationLoader.class);

    public static final String CONFIG_PROPERTY = "spamsig.config";
    private static final String DEFAULT_CONFIGURATION = "spamsig.yaml";

    static URL getConfigURL() throws ConfigurationException
    {
        String configUrl = System.getProperty(CONFIG_PROPERTY, DEFAULT_CONFIGURATION);

        try
        {
            URL url = new URL(configUrl);
            url.openStream().close();
            return url;
        }
        catch (IOException e)
        {
            logger.debug("{} is not a reachable URL, looking for a file or classpath resource", configUrl);
        }

        Path path = Paths.get(configUrl);
        if (Files.isRegularFile(path))
        {
            try
            {
                return path.toUri().toURL();
            }
            catch (MalformedURLException e)
            {
                throw new ConfigurationException("Invalid configuration path " + configUrl, e);
            }
        }

        URL url = YamlConfigurationLoader.class.getClassLoader().getResource(configUrl);
        if (url == null)
            throw new ConfigurationException("Cannot locate " + configUrl + ". Set -D" + CONFIG_PROPERTY +
                                             " to a URL, a file or a classpath resource.");
        return url;
    }

    public Config loadConfig() throws ConfigurationException
    {
        return loadConfig(getConfigURL());
    }

    public Config loadConfig(URL url) throws ConfigurationException
    {
        byte[] configBytes;
        try
        {
            configBytes = Resources.toByteArray(url);
        }
        catch (IOException e)
        {
            throw new ConfigurationException("Unable to read " + url, e);
        }

        logger.info("Loading settings from {}", url);
        try
        {
            Yaml yaml = new Yaml(new Constructor(Config.class, new LoaderOptions()));
            Config config = yaml.loadAs(new ByteArrayInputStream(configBytes), Config.class);
            // an empty file means all defaults
            return config == null ? new Config() : config;
        }
        catch (YAMLException e)
        {
            throw new ConfigurationException("Invalid yaml in " + url + ": " + e.getMessage(), e);
        }
    }
}
