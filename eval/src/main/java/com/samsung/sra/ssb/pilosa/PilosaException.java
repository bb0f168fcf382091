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
package com.samsung.sra.ssb.pilosa;

/** Failed request to a Pilosa server: transport error, unexpected status, or an error reported by the engine. */
public class PilosaException extends Exception {
    /** Status code of the response, or 0 if no response was received */
    private final int statusCode;

    public PilosaException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public PilosaException(int statusCode, String message) {
        super(statusCode + ": " + message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
