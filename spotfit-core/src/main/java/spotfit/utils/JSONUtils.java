/*
 * Copyright (C) 2018 Jean Ollion
 *
 * This File is part of SPOTFIT
 *
 * SPOTFIT is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * SPOTFIT is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with SPOTFIT.  If not, see <http://www.gnu.org/licenses/>.
 */
package spotfit.utils;

import org.json.simple.JSONAware;
import org.json.simple.JSONObject;
import org.json.simple.parser.JSONParser;
import org.json.simple.parser.ParseException;

import java.util.function.Supplier;

/**
 *
 * @author Jean Ollion
 */
public class JSONUtils {
    public static String serialize(JSONSerializable o) {
        Object entry = o.toJSONEntry();
        if (entry instanceof JSONAware) return ((JSONAware)entry).toJSONString();
        else return entry.toString();
    }
    public static JSONObject parse(String s) throws ParseException {
        Object res= new JSONParser().parse(s);
        if (!(res instanceof JSONObject)) throw new ParseException(ParseException.ERROR_UNEXPECTED_TOKEN, res);
        return (JSONObject)res;
    }
    public static <T extends JSONSerializable> T parse(Supplier<T> factory, String s) throws ParseException {
        T res = factory.get();
        res.initFromJSONEntry(parse(s));
        return res;
    }
    public static double getDouble(JSONObject json, String key, double defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        if (!(o instanceof Number)) throw new IllegalArgumentException("Entry "+key+" is not a number: "+o);
        return ((Number)o).doubleValue();
    }
    public static int getInt(JSONObject json, String key, int defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        if (!(o instanceof Number)) throw new IllegalArgumentException("Entry "+key+" is not a number: "+o);
        return ((Number)o).intValue();
    }
    public static boolean getBoolean(JSONObject json, String key, boolean defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        if (!(o instanceof Boolean)) throw new IllegalArgumentException("Entry "+key+" is not a boolean: "+o);
        return (Boolean)o;
    }
    public static <E extends Enum<E>> E getEnum(JSONObject json, String key, Class<E> enumType, E defaultValue) {
        Object o = json.get(key);
        if (o==null) return defaultValue;
        try {
            return Enum.valueOf(enumType, o.toString());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Entry "+key+": unknown value "+o+" for "+enumType.getSimpleName(), e);
        }
    }
}
