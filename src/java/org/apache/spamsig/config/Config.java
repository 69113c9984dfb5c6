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

import java.util.concurrent.TimeUnit;

/**
 * Server configuration, populated from spamsig.yaml. Field names match the keys
 * in the file.
 */
public class Config
{
    // username : key lines; if the file is missing only the anonymous user is served
    public String accounts_file = "conf/spamsig.passwd";

    // operations : users : allow|deny lines; if the file is missing the default ACL applies
    public String access_file = "conf/spamsig.access";

    // IDigestBackend implementation, constructed through its no-arg constructor
    public String digest_backend = "org.apache.spamsig.db.InMemoryDigestBackend";

    public String digest_store_name = "digests";

    // records not reported or whitelisted for this long are removed; null or <= 0 keeps them forever
    public Long digest_max_age_seconds = TimeUnit.DAYS.toSeconds(120);

    public long reorganize_period_seconds = TimeUnit.DAYS.toSeconds(1);

    // <= 0 disables periodic flushing of the backend
    public long sync_period_seconds = 60;

    public String toString()
    {
        return String.format("{ accounts_file: %s, access_file: %s, digest_backend: %s, digest_store_name: %s, " +
                             "digest_max_age_seconds: %s, reorganize_period_seconds: %d, sync_period_seconds: %d }",
                             accounts_file, access_file, digest_backend, digest_store_name,
                             digest_max_age_seconds, reorganize_period_seconds, sync_period_seconds);
    }
}
