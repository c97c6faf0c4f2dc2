package com.tony.baseballAnalytics.exception;

public class ModelNotLoadedException extends RuntimeException {

    public ModelNotLoadedException() {
        super("Aucun modèle tactique chargé : entraîner ou charger un modèle avant la prédiction");
    }
}
