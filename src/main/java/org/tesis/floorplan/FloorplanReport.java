package org.tesis.floorplan;

import java.text.DecimalFormat;
import java.text.DecimalFormatSymbols;
import java.util.Locale;

/* Resumen de una corrida. */
public final class FloorplanReport {
    int hojas;
    int cortes;
    int anchoRaiz;
    int altoRaiz;
    double areaHojas;
    double areaRaiz;
    double areaDesperdiciada;
    long tiempoMs;

    public int leaves() { return hojas; }

    public int cuts() { return cortes; }

    public double utilization() {
        return areaRaiz > 0 ? (areaHojas / areaRaiz) * 100.0 : 0.0;
    }

    String formatResumen() {
        DecimalFormatSymbols sym = new DecimalFormatSymbols(Locale.US);
        DecimalFormat f3 = new DecimalFormat("#,##0.000", sym);
        DecimalFormat f0 = new DecimalFormat("#,##0", sym);

        StringBuilder sb = new StringBuilder();
        sb.append("------------------------------\n");
        sb.append("RESUMEN FINAL (SLICING)\n");
        sb.append("Hojas              : ").append(f0.format(hojas)).append("\n");
        sb.append("Cortes             : ").append(f0.format(cortes)).append("\n");
        sb.append("Raíz               : ").append(anchoRaiz).append(" x ").append(altoRaiz).append("\n");
        sb.append("% aprovechamiento  : ").append(f3.format(utilization())).append(" %\n");
        sb.append("Área hojas         : ").append(f3.format(areaHojas)).append("\n");
        sb.append("Área raíz          : ").append(f3.format(areaRaiz)).append("\n");
        sb.append("Área desperdiciada : ").append(f3.format(areaDesperdiciada)).append("\n");
        sb.append("Tiempo total       : ").append(f0.format(tiempoMs)).append(" ms\n");
        sb.append("------------------------------");
        return sb.toString();
    }
}
