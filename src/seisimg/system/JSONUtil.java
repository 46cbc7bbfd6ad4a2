/*
 * To change this license header, choose License Headers in Project Properties.
 * To change this template file, choose Tools | Templates
 * and open the template in the editor.
 */
package seisimg.system;

import org.json.JSONArray;
import org.json.JSONObject;

/**
 * Helpers for reading optional arrays and nested values out of configuration
 * objects.
 */
public abstract class JSONUtil
{
	public static JSONArray optJSONArray(JSONObject oObj, String sKey)
	{
		JSONArray oRet = oObj.optJSONArray(sKey);
		if (oRet == null)
		{
			oRet = new JSONArray();
		}
		return oRet;
	}


	public static String[] getStringArray(JSONObject oObj, String sKey)
	{
		JSONArray oArr = optJSONArray(oObj, sKey);
		String[] sRet = new String[oArr.length()];
		for (int nIndex = 0; nIndex < sRet.length; nIndex++)
			sRet[nIndex] = oArr.getString(nIndex);

		return sRet;
	}


	/**
	 * Reads the named numeric members of a JSON object into a double array.
	 * Members that are missing are set to {@code Double.NaN}.
	 *
	 * @param oObj object to read
	 * @param sKeys member names, in the order they are stored
	 * @return array the same length as {@code sKeys}
	 */
	public static double[] getDoubles(JSONObject oObj, String... sKeys)
	{
		double[] dRet = new double[sKeys.length];
		for (int nIndex = 0; nIndex < dRet.length; nIndex++)
			dRet[nIndex] = oObj.optDouble(sKeys[nIndex], Double.NaN);

		return dRet;
	}


	/**
	 * Reads an enumerated value by name, ignoring case.
	 *
	 * @param <E> enum type
	 * @param oObj object to read
	 * @param sKey member name
	 * @param oDefault value returned if the member is missing
	 * @return the enum constant
	 * @throws IllegalArgumentException if the member does not name a constant
	 */
	public static <E extends Enum<E>> E optEnum(JSONObject oObj, String sKey, E oDefault)
	{
		String sVal = oObj.optString(sKey, null);
		if (sVal == null)
			return oDefault;

		for (E oConst : oDefault.getDeclaringClass().getEnumConstants())
		{
			if (oConst.name().equalsIgnoreCase(sVal))
				return oConst;
		}
		throw new IllegalArgumentException(String.format("Invalid value for %s: %s", sKey, sVal));
	}
}
