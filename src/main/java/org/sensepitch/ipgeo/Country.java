package org.sensepitch.ipgeo;

/**
 * @param code ISO 3166-1 alpha-2 code
 * @param name localized name
 */
public record Country(String code, String name) {}
