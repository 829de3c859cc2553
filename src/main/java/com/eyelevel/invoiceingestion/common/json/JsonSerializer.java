package com.eyelevel.invoiceingestion.common.json;

/**
 * Defines the contract for serializing Java objects into JSON.
 */
public interface JsonSerializer {

    <T> String serialize(T object);
}
