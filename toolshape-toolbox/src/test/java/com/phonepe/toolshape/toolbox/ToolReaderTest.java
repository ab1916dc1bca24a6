/*
 * Copyright (c) 2025 Original Author(s), PhonePe India Pvt. Ltd.
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

package com.phonepe.toolshape.toolbox;

import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import com.phonepe.toolshape.core.source.Tool;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ToolReaderTest {

    public static class ExtendedWeatherTools extends WeatherTools {
        @Override
        @Tool("Weather forecast with alerts")
        public String getWeather(@JsonPropertyDescription("Name of the city") String city, int days) {
            return "Storm warning for " + city;
        }

        @Tool(name = "air_quality", value = "Air quality index for a city")
        public int aqi(String city) {
            return 42;
        }
    }

    @Test
    void testReadTools() {
        final var tools = ToolReader.readTools(new WeatherTools());
        assertEquals(List.of("city_info", "explode", "get_weather", "record", "convert"),
                     List.copyOf(tools.keySet()));
        assertFalse(tools.containsKey("not_a_tool"));
        final var weather = tools.get("get_weather");
        assertEquals("get_weather", weather.name());
        assertEquals("get_weather", weather.schema().title());
        assertEquals("Sunny in Pune for 3 days", weather.invoke("{\"city\": \"Pune\"}"));
    }

    @Test
    void testSubclassOverrides() {
        final var tools = ToolReader.readTools(new ExtendedWeatherTools(), ToolSettings.defaults());
        assertEquals(List.of("air_quality", "get_weather", "city_info", "explode", "record", "convert"),
                     List.copyOf(tools.keySet()));
        final var weather = tools.get("get_weather");
        assertEquals("Weather forecast with alerts", weather.description());
        assertEquals(List.of("city", "days"), weather.schema().required());
        assertEquals("Storm warning for Pune", weather.invoke("{\"city\": \"Pune\", \"days\": 1}"));
        assertEquals("42", tools.get("air_quality").call("{\"city\": \"Pune\"}").getContent());
    }

    @Test
    void testToolName() throws NoSuchMethodException {
        assertEquals("get_weather", ToolReader.toolName(WeatherTools.class.getMethod("getWeather", String.class, int.class)));
        assertEquals("convert", ToolReader.toolName(WeatherTools.class.getMethod("toFahrenheit", double.class)));
        assertEquals("not_a_tool", ToolReader.toolName(WeatherTools.class.getMethod("notATool", String.class)));
    }
}
