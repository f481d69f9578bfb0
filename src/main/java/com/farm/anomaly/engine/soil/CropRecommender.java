package com.farm.anomaly.engine.soil;

import com.farm.anomaly.model.CropSuggestion;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ranks crops by how close the reading sits to each crop's preferred nutrient or pH value.
 *
 * wheat: 1 - |N - 90| / 100
 * rice:  1 - |ph - 6.5| / 10
 * corn:  1 - |K - 40| / 50
 *
 * Highest score first; ties keep the order above.
 */
@Component
public class CropRecommender {

    public List<CropSuggestion> recommend(double nitrogen, double phosphorus, double potassium, double ph) {
        List<CropSuggestion> crops = new ArrayList<>(3);
        crops.add(new CropSuggestion("wheat", 1.0 - Math.abs(nitrogen - 90.0) / 100.0));
        crops.add(new CropSuggestion("rice", 1.0 - Math.abs(ph - 6.5) / 10.0));
        crops.add(new CropSuggestion("corn", 1.0 - Math.abs(potassium - 40.0) / 50.0));
        // List.sort is stable
        crops.sort(Comparator.comparingDouble(CropSuggestion::getScore).reversed());
        return crops;
    }
}
