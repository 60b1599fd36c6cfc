package roadwatch.config;

import lombok.Builder;

/**
 * Opciones parciales de reconfiguración. Los campos nulos conservan el valor vigente.
 * <p>
 * Sólo enumera lo que el plano de control puede cambiar en caliente: tamaño de ventana,
 * umbrales de cada detector, quórum y longitudes de racha del ciclo de vida.
 */
@Builder
public record DetectionOptions(
        Integer windowSize,
        Double cusumThreshold,
        Double cusumDrift,
        Double sprtUpperBound,
        Double sprtLowerBound,
        Double sprtNormalMean,
        Double sprtNormalStd,
        Double sprtAnomalousMean,
        Double sprtAnomalousStd,
        Double pageHinkleyThreshold,
        Double pageHinkleyDelta,
        Double pageHinkleyStatisticCap,
        Integer quorum,
        Integer confirmationRunLength,
        Integer hysteresisRunLength
) {

    /**
     * Fusiona las opciones sobre una configuración base. No valida el resultado.
     */
    public DetectionConfig applyTo(DetectionConfig base) {
        DetectionConfig.DetectionConfigBuilder builder = base.toBuilder();
        if (windowSize != null) builder.windowSize(windowSize);
        if (cusumThreshold != null) builder.cusumThreshold(cusumThreshold);
        if (cusumDrift != null) builder.cusumDrift(cusumDrift);
        if (sprtUpperBound != null) builder.sprtUpperBound(sprtUpperBound);
        if (sprtLowerBound != null) builder.sprtLowerBound(sprtLowerBound);
        if (sprtNormalMean != null) builder.sprtNormalMean(sprtNormalMean);
        if (sprtNormalStd != null) builder.sprtNormalStd(sprtNormalStd);
        if (sprtAnomalousMean != null) builder.sprtAnomalousMean(sprtAnomalousMean);
        if (sprtAnomalousStd != null) builder.sprtAnomalousStd(sprtAnomalousStd);
        if (pageHinkleyThreshold != null) builder.pageHinkleyThreshold(pageHinkleyThreshold);
        if (pageHinkleyDelta != null) builder.pageHinkleyDelta(pageHinkleyDelta);
        if (pageHinkleyStatisticCap != null) builder.pageHinkleyStatisticCap(pageHinkleyStatisticCap);
        if (quorum != null) builder.quorum(quorum);
        if (confirmationRunLength != null) builder.confirmationRunLength(confirmationRunLength);
        if (hysteresisRunLength != null) builder.hysteresisRunLength(hysteresisRunLength);
        return builder.build();
    }

    public boolean isEmpty() {
        return windowSize == null && cusumThreshold == null && cusumDrift == null
                && sprtUpperBound == null && sprtLowerBound == null
                && sprtNormalMean == null && sprtNormalStd == null
                && sprtAnomalousMean == null && sprtAnomalousStd == null
                && pageHinkleyThreshold == null && pageHinkleyDelta == null && pageHinkleyStatisticCap == null
                && quorum == null && confirmationRunLength == null && hysteresisRunLength == null;
    }
}
