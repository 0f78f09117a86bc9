package com.jeevo.validation.rules;

import java.util.List;

/**
 * A medication that must not be recommended when the query mentions a given population.
 *
 * @param medication         label used in the human-readable pairing
 * @param medicationTerms    terms that mean the medication is mentioned in the answer
 * @param population         label of the contraindicated population
 * @param populationTerms    terms that mean the population is mentioned in the query
 * @param populationPatterns regular expressions that also identify the population (e.g. ages)
 * @param reason             why the pairing is dangerous
 */
public record DangerousCombination(
        String medication,
        List<String> medicationTerms,
        String population,
        List<String> populationTerms,
        List<String> populationPatterns,
        String reason
) {

    public DangerousCombination {
        medicationTerms = medicationTerms == null ? List.of() : List.copyOf(medicationTerms);
        populationTerms = populationTerms == null ? List.of() : List.copyOf(populationTerms);
        populationPatterns = populationPatterns == null ? List.of() : List.copyOf(populationPatterns);
    }

    public String describe() {
        return medication + " + " + population + ": " + reason;
    }
}
