package com.indiaforecast.forecast.fetcher;

import com.indiaforecast.common.model.Sector;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/** The primary World Bank indicator tracked per sector, with the metric name and unit it reports under. */
public record WorldBankIndicator(String code, String metric, String unit) {

    private static final Map<Sector, WorldBankIndicator> BY_SECTOR = new EnumMap<>(Sector.class);

    static {
        BY_SECTOR.put(Sector.ECONOMY,            new WorldBankIndicator("NY.GDP.MKTP.KD.ZG", "GDP Growth Rate", "%"));
        BY_SECTOR.put(Sector.ENERGY,             new WorldBankIndicator("EG.FEC.RNEW.ZS", "Renewable Energy Share", "%"));
        BY_SECTOR.put(Sector.TECHNOLOGY,         new WorldBankIndicator("IT.NET.USER.ZS", "Internet Users", "%"));
        BY_SECTOR.put(Sector.AGRICULTURE,        new WorldBankIndicator("AG.PRD.CREL.MT", "Cereal Production", "tonnes"));
        BY_SECTOR.put(Sector.EDUCATION,          new WorldBankIndicator("SE.ADT.LITR.ZS", "Literacy Rate", "%"));
        BY_SECTOR.put(Sector.HEALTHCARE,         new WorldBankIndicator("SP.DYN.LE00.IN", "Life Expectancy", "years"));
        BY_SECTOR.put(Sector.ENVIRONMENT,        new WorldBankIndicator("AG.LND.FRST.K2", "Forest Area", "sq km"));
        BY_SECTOR.put(Sector.SOCIAL_DEVELOPMENT, new WorldBankIndicator("SP.POP.TOTL", "Population", "people"));
    }

    /** Empty for sectors the World Bank series do not cover (infrastructure). */
    public static Optional<WorldBankIndicator> forSector(Sector sector) {
        return Optional.ofNullable(BY_SECTOR.get(sector));
    }
}
