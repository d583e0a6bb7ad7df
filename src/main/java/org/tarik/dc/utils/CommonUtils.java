/*
 * Copyright © 2025 Taras Paruta (partarstu@gmail.com)
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
package org.tarik.dc.utils;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

import static java.util.Optional.empty;
import static java.util.Optional.of;

public class CommonUtils {
    private static final Logger LOG = LoggerFactory.getLogger(CommonUtils.class);

    public static boolean isNotBlank(String str) {
        return str != null && !str.isBlank();
    }

    public static boolean isBlank(String str) {
        return !isNotBlank(str);
    }

    public static Optional<Integer> parseStringAsInteger(String str) {
        if (isBlank(str)) {
            return empty();
        }
        try {
            return of(Integer.parseInt(str.trim()));
        } catch (NumberFormatException e) {
            LOG.debug("'{}' is not a valid integer", str);
            return empty();
        }
    }

    public static Optional<Double> parseStringAsDouble(String str) {
        if (isBlank(str)) {
            return empty();
        }
        try {
            return of(Double.parseDouble(str.trim()));
        } catch (NumberFormatException e) {
            LOG.debug("'{}' is not a valid double", str);
            return empty();
        }
    }

    public static String getRootCauseMessage(Throwable throwable) {
        Throwable cause = throwable;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        var message = cause.getMessage();
        return isNotBlank(message) ? message : cause.getClass().getSimpleName();
    }
}
