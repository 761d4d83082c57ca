package com.expektra.opendata.infrastructure.adapter.provider;

import com.fasterxml.jackson.databind.JsonNode;
import retrofit2.Call;
import retrofit2.http.GET;
import retrofit2.http.Query;

/**
 * eSett Open Data endpoints.
 * Every dataset takes a UTC window formatted {@code yyyy-MM-dd'T'HH:mm:ss.000Z} and the EIC code of the
 * market balance area, and answers with a JSON array of records or {@code 204 No Content}.
 */
public interface EsettApi {

    @GET("EXP16/Volumes")
    Call<JsonNode> production(@Query("start") String start, @Query("end") String end, @Query("mba") String mba);

    @GET("EXP15/Consumption")
    Call<JsonNode> consumption(@Query("start") String start, @Query("end") String end, @Query("mba") String mba);

    @GET("EXP14/Prices")
    Call<JsonNode> prices(@Query("start") String start, @Query("end") String end, @Query("mba") String mba);

    /**
     * @param mga metering grid area EIC code, or {@code null} for the zone-wide profile
     */
    @GET("EXP18/LoadProfile")
    Call<JsonNode> loadProfile(@Query("start") String start, @Query("end") String end, @Query("mba") String mba,
                               @Query("mga") String mga);
}
