package roadwatch.detection.predictor;

import java.util.NoSuchElementException;

/**
 * Ventana deslizante de capacidad fija sobre un buffer circular.
 * Al llenarse, cada inserción expulsa la observación más antigua.
 */
public class RollingWindow {

    private double[] buffer;
    private int head;   // índice de la observación más antigua
    private int size;

    public RollingWindow(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("La capacidad de la ventana debe ser positiva.");
        }
        this.buffer = new double[capacity];
    }

    public void add(double value) {
        if (size < buffer.length) {
            buffer[(head + size) % buffer.length] = value;
            size++;
        } else {
            buffer[head] = value;
            head = (head + 1) % buffer.length;
        }
    }

    public double last() {
        if (size == 0) {
            throw new NoSuchElementException("Ventana vacía");
        }
        return buffer[(head + size - 1) % buffer.length];
    }

    /**
     * Copia ordenada de la más antigua a la más reciente.
     */
    public double[] toArray() {
        double[] copy = new double[size];
        for (int i = 0; i < size; i++) {
            copy[i] = buffer[(head + i) % buffer.length];
        }
        return copy;
    }

    /**
     * Cambia la capacidad conservando las observaciones más recientes que quepan.
     */
    public void resize(int newCapacity) {
        if (newCapacity <= 0) {
            throw new IllegalArgumentException("La capacidad de la ventana debe ser positiva.");
        }
        if (newCapacity == buffer.length) {
            return;
        }
        double[] ordered = toArray();
        int keep = Math.min(ordered.length, newCapacity);
        double[] next = new double[newCapacity];
        System.arraycopy(ordered, ordered.length - keep, next, 0, keep);
        this.buffer = next;
        this.head = 0;
        this.size = keep;
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return buffer.length;
    }

    public boolean isEmpty() {
        return size == 0;
    }
}
