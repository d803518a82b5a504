package com.bubblegrade.service.parser;

import com.bubblegrade.model.CurpDetails;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Format check and structural decoding of the Mexican population registry code (CURP).
 */
@Component
public class CurpValidator {

    public static final Pattern CURP_PATTERN = Pattern.compile("^[A-Z]{4}\\d{6}[HM][A-Z]{5}\\d{2}$");

    private static final String CHECK_ALPHABET = "0123456789ABCDEFGHIJKLMNOPQRSTUVWXYZ";

    private static final Map<String, String> FEDERAL_ENTITIES = Map.ofEntries(
            Map.entry("AS", "AGUASCALIENTES"),
            Map.entry("BC", "BAJA CALIFORNIA"),
            Map.entry("BS", "BAJA CALIFORNIA SUR"),
            Map.entry("CC", "CAMPECHE"),
            Map.entry("CL", "COAHUILA"),
            Map.entry("CM", "COLIMA"),
            Map.entry("CS", "CHIAPAS"),
            Map.entry("CH", "CHIHUAHUA"),
            Map.entry("DF", "CIUDAD DE MEXICO"),
            Map.entry("DG", "DURANGO"),
            Map.entry("GT", "GUANAJUATO"),
            Map.entry("GR", "GUERRERO"),
            Map.entry("HG", "HIDALGO"),
            Map.entry("JC", "JALISCO"),
            Map.entry("MC", "MEXICO"),
            Map.entry("MN", "MICHOACAN"),
            Map.entry("MS", "MORELOS"),
            Map.entry("NT", "NAYARIT"),
            Map.entry("NL", "NUEVO LEON"),
            Map.entry("OC", "OAXACA"),
            Map.entry("PL", "PUEBLA"),
            Map.entry("QT", "QUERETARO"),
            Map.entry("QR", "QUINTANA ROO"),
            Map.entry("SP", "SAN LUIS POTOSI"),
            Map.entry("SL", "SINALOA"),
            Map.entry("SR", "SONORA"),
            Map.entry("TC", "TABASCO"),
            Map.entry("TS", "TAMAULIPAS"),
            Map.entry("TL", "TLAXCALA"),
            Map.entry("VZ", "VERACRUZ"),
            Map.entry("YN", "YUCATAN"),
            Map.entry("ZS", "ZACATECAS"),
            Map.entry("NE", "NACIDO EN EL EXTRANJERO"));

    public boolean matchesFormat(String curp) {
        return curp != null && CURP_PATTERN.matcher(curp).matches();
    }

    /**
     * Decodes birth date, sex and state of birth from a well-formed CURP. Attributes that do not
     * decode (an impossible date, an unknown state code) are left {@code null}.
     *
     * @return empty when the value does not match the CURP format
     */
    public Optional<CurpDetails> inspect(String curp) {
        if (!matchesFormat(curp)) {
            return Optional.empty();
        }
        return Optional.of(new CurpDetails(
                birthDate(curp.substring(4, 10)),
                curp.substring(10, 11),
                FEDERAL_ENTITIES.get(curp.substring(11, 13)),
                checkDigitValid(curp)));
    }

    private LocalDate birthDate(String yymmdd) {
        int year = Integer.parseInt(yymmdd.substring(0, 2));
        int month = Integer.parseInt(yymmdd.substring(2, 4));
        int day = Integer.parseInt(yymmdd.substring(4, 6));
        int fullYear = year <= 30 ? 2000 + year : 1900 + year;
        try {
            return LocalDate.of(fullYear, month, day);
        } catch (DateTimeException ex) {
            return null;
        }
    }

    static boolean checkDigitValid(String curp) {
        return Character.getNumericValue(curp.charAt(17)) == checkDigit(curp);
    }

    /**
     * Weighted sum of the first seventeen characters, weights 18 down to 2.
     */
    static int checkDigit(String curp) {
        int sum = 0;
        for (int i = 0; i < 17; i++) {
            sum += CHECK_ALPHABET.indexOf(curp.charAt(i)) * (18 - i);
        }
        return (10 - sum % 10) % 10;
    }
}
