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
package com.samsung.sra.arraystore;

import java.io.*;

public class Utilities {
    private Utilities() {}

    /** stuff val into array[startPos], ..., array[startPos+3] */
    public static void intToByteArray(int val, byte[] array, int startPos) {
        array[startPos    ] = (byte) ((val >> 24) & 0xFF);
        array[startPos + 1] = (byte) ((val >> 16) & 0xFF);
        array[startPos + 2] = (byte) ((val >> 8)  & 0xFF);
        array[startPos + 3] = (byte)  (val        & 0xFF);
    }

    /** return the int represented by array[startPos], ..., array[startPos+3] */
    public static int byteArrayToInt(byte[] array, int startPos) {
        return
                ((array[startPos    ] & 0xFF) << 24) |
                ((array[startPos + 1] & 0xFF) << 16) |
                ((array[startPos + 2] & 0xFF) << 8) |
                 (array[startPos + 3] & 0xFF);
    }

    public static <T> byte[] serialize(T obj) throws IOException {
        try (ByteArrayOutputStream b = new ByteArrayOutputStream()) {
            try (ObjectOutputStream o = new ObjectOutputStream(b)) {
                o.writeObject(obj);
            }
            return b.toByteArray();
        }
    }

    @SuppressWarnings("unchecked")
    public static <T> T deserialize(byte[] bytes) throws IOException, ClassNotFoundException {
        try (ByteArrayInputStream b = new ByteArrayInputStream(bytes)) {
            try (ObjectInputStream o = new ObjectInputStream(b)) {
                return (T) o.readObject();
            }
        }
    }
}
